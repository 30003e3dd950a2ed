package io.github.drompincen.screencontrol.gateway.config;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.runtime.shell.ShellSettings;
import io.github.drompincen.screencontrol.runtime.tools.ToolSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderConfigTest {

    private final ProviderConfig config = new ProviderConfig();

    @Test
    void disabledCategoriesAcceptIdsAndNames() {
        ScreenControlProperties properties = new ScreenControlProperties();
        properties.getTools().setDisabledCategories(Set.of("browser", "SHELL"));
        properties.getTools().setDisabledTools(Set.of("wait"));

        ToolSettings settings = config.toolSettings(properties);

        assertThat(settings.disabledCategories()).containsExactlyInAnyOrder(ToolCategory.BROWSER, ToolCategory.SHELL);
        assertThat(settings.isEnabled("wait", ToolCategory.GUI)).isFalse();
        assertThat(settings.isEnabled("fs_read", ToolCategory.FILESYSTEM)).isTrue();
    }

    @Test
    void unknownCategoryFailsStartup() {
        ScreenControlProperties properties = new ScreenControlProperties();
        properties.getTools().setDisabledCategories(Set.of("printer"));

        assertThatThrownBy(() -> config.toolSettings(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("printer");
    }

    @Test
    void shellSettingsUseConfiguredWorkingDirectory(@TempDir Path dir) {
        ScreenControlProperties properties = new ScreenControlProperties();
        properties.getShell().setWorkingDirectory(dir.toString());
        properties.getShell().setMaxOutputBytes(2048);

        ShellSettings settings = config.shellSettings(properties);

        assertThat(settings.workingDirectory()).isEqualTo(dir.toAbsolutePath().normalize());
        assertThat(settings.maxOutputBytes()).isEqualTo(2048);
        assertThat(settings.defaultTimeoutSeconds()).isEqualTo(600);
    }

    @Test
    void defaultsMatchDocumentedValues() {
        ScreenControlProperties properties = new ScreenControlProperties();

        assertThat(properties.getHttp().getPort()).isEqualTo(3456);
        assertThat(properties.getHttp().getMaxRequestBytes()).isEqualTo(1024 * 1024);
        assertThat(properties.getHttp().getReceiveTimeoutMs()).isEqualTo(5000);
        assertThat(properties.getBrowser().getBridgeUrl()).isEqualTo("http://127.0.0.1:3457");
        assertThat(properties.getMcp().isStdio()).isFalse();
    }
}
