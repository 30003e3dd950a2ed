package io.github.drompincen.screencontrol.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolDefinition;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point shared by the HTTP and MCP transports. Never throws: every
 * outcome, including provider faults, comes back as a {@link ToolResult}.
 */
@Service
public class ToolRouter {

    private static final Logger log = LoggerFactory.getLogger(ToolRouter.class);

    private final ToolRegistry registry;
    private final Map<ToolCategory, ToolProvider> providers = new EnumMap<>(ToolCategory.class);

    public ToolRouter(ToolRegistry registry, List<ToolProvider> providers) {
        this.registry = registry;
        for (ToolProvider provider : providers) {
            ToolProvider previous = this.providers.put(provider.category(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two providers registered for category " + provider.category());
            }
        }
    }

    public ToolResult invoke(ToolInvocation invocation) {
        Optional<ToolDefinition> definition = registry.describe(invocation.name());
        if (definition.isEmpty()) {
            return ToolResult.failure("Unknown tool: " + invocation.name());
        }

        List<String> missing = missingParameters(definition.get(), invocation.arguments());
        if (!missing.isEmpty()) {
            return ToolResult.failure("Missing required parameter(s): " + String.join(", ", missing));
        }

        ToolProvider provider = providers.get(definition.get().category());
        if (provider == null) {
            return ToolResult.failure("No provider available for " + definition.get().category().label());
        }

        log.debug("Invoking tool {}", invocation.name());
        try {
            ToolResult result = provider.execute(invocation);
            return result != null ? result : ToolResult.failure("Tool returned no result: " + invocation.name());
        } catch (RuntimeException e) {
            log.error("Tool {} failed", invocation.name(), e);
            return ToolResult.failure("Tool execution failed: " + e.getMessage());
        }
    }

    private static List<String> missingParameters(ToolDefinition definition, JsonNode arguments) {
        List<String> missing = new ArrayList<>();
        for (String param : definition.requiredParameters()) {
            JsonNode value = arguments.get(param);
            if (value == null || value.isNull()) {
                missing.add(param);
            }
        }
        return missing;
    }
}
