package io.github.drompincen.screencontrol.protocol.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A JSON-RPC 2.0 response. {@code id} is always written, as {@code null} when the request
 * id could not be read.
 */
public record JsonRpcResponse(
        String jsonrpc,
        @JsonInclude(JsonInclude.Include.ALWAYS) JsonNode id,
        @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode result,
        @JsonInclude(JsonInclude.Include.NON_NULL) JsonRpcError error
) {
    public static final String VERSION = "2.0";

    public static JsonRpcResponse result(JsonNode id, JsonNode result) {
        return new JsonRpcResponse(VERSION, id, result, null);
    }

    public static JsonRpcResponse error(JsonNode id, JsonRpcError error) {
        return new JsonRpcResponse(VERSION, id, null, error);
    }

    public static JsonRpcResponse error(JsonNode id, int code, String message) {
        return error(id, new JsonRpcError(code, message));
    }
}
