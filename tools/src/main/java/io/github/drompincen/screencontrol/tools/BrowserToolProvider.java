package io.github.drompincen.screencontrol.tools;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelay;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelayException;
import io.github.drompincen.screencontrol.runtime.tools.ToolProvider;
import io.github.drompincen.screencontrol.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Forwards every {@code browser_*} tool to the relay as {@code {action, payload, browser?}}. */
public class BrowserToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(BrowserToolProvider.class);
    private static final String PREFIX = "browser_";

    private final BrowserRelay relay;

    public BrowserToolProvider(BrowserRelay relay) {
        this.relay = relay;
    }

    @Override
    public ToolCategory category() {
        return ToolCategory.BROWSER;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        if (!invocation.name().startsWith(PREFIX)) {
            return ToolResult.failure("Unknown browser tool: " + invocation.name());
        }
        String action = invocation.name().substring(PREFIX.length());
        String browser = ToolArguments.text(invocation.arguments(), "browser");
        try {
            return ToolResult.success(relay.forward(action, invocation.arguments(), browser));
        } catch (BrowserRelayException e) {
            log.debug("Browser action {} failed: {}", action, e.getMessage());
            return ToolResult.failure(e.getMessage());
        }
    }
}
