package io.github.drompincen.screencontrol.runtime.tools;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelay;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolAvailabilityTest {

    @Test
    void browserCategoryFollowsRelayConnection() {
        BrowserRelay relay = mock(BrowserRelay.class);
        ToolAvailability availability = new ToolAvailability(relay);

        when(relay.isConnected()).thenReturn(false);
        assertThat(availability.current()).doesNotContain(ToolCategory.BROWSER)
                .contains(ToolCategory.GUI, ToolCategory.FILESYSTEM, ToolCategory.SHELL);

        when(relay.isConnected()).thenReturn(true);
        assertThat(availability.current()).contains(ToolCategory.BROWSER);
    }
}
