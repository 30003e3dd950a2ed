package io.github.drompincen.screencontrol.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record ToolInvocation(
        String name,
        ObjectNode arguments
) {
    public ToolInvocation {
        if (arguments == null) {
            arguments = JsonNodeFactory.instance.objectNode();
        }
    }

    /** Anything other than a JSON object is treated as an empty argument map. */
    public static ToolInvocation of(String name, JsonNode arguments) {
        return new ToolInvocation(name, arguments instanceof ObjectNode obj ? obj : null);
    }
}
