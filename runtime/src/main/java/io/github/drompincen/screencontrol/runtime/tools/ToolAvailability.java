package io.github.drompincen.screencontrol.runtime.tools;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelay;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/** Categories that can be advertised right now. Browser tools need a connected relay. */
@Component
public class ToolAvailability {

    private final BrowserRelay browserRelay;

    public ToolAvailability(BrowserRelay browserRelay) {
        this.browserRelay = browserRelay;
    }

    public Set<ToolCategory> current() {
        Set<ToolCategory> categories = EnumSet.allOf(ToolCategory.class);
        if (!browserRelay.isConnected()) {
            categories.remove(ToolCategory.BROWSER);
        }
        return categories;
    }
}
