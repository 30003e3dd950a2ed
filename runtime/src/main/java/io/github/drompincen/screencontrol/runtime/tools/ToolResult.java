package io.github.drompincen.screencontrol.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }

    /** Failure that still carries whatever the tool produced, e.g. output captured before a timeout. */
    public static ToolResult failure(String error, JsonNode partialOutput) {
        return new ToolResult(false, partialOutput, error);
    }
}
