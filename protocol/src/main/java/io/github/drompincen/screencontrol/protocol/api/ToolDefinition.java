package io.github.drompincen.screencontrol.protocol.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of one advertised tool. Parameter order is preserved so that
 * generated schemas are stable across calls.
 */
public record ToolDefinition(
        String name,
        String description,
        Map<String, ParameterSpec> parameters,
        List<String> requiredParameters,
        ToolCategory category
) {
    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        requiredParameters = requiredParameters == null ? List.of() : List.copyOf(requiredParameters);
        if (category == null) {
            category = ToolCategory.forToolName(name);
        }
    }

    /** JSON schema of the tool arguments; {@code required} is omitted when nothing is required. */
    public ObjectNode inputSchema() {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        parameters.forEach((paramName, spec) -> props.set(paramName, spec.toJson()));
        if (!requiredParameters.isEmpty()) {
            var required = schema.putArray("required");
            requiredParameters.forEach(required::add);
        }
        return schema;
    }

    /** Shape used by MCP {@code tools/list}. */
    public ObjectNode toMcpTool() {
        ObjectNode tool = JsonNodeFactory.instance.objectNode();
        tool.put("name", name);
        tool.put("description", description);
        tool.set("inputSchema", inputSchema());
        return tool;
    }
}
