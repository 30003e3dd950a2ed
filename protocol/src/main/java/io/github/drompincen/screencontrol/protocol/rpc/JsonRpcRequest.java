package io.github.drompincen.screencontrol.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Optional;

public record JsonRpcRequest(
        String jsonrpc,
        JsonNode id,
        String method,
        JsonNode params
) {
    public JsonRpcRequest {
        if (params == null) {
            params = MissingNode.getInstance();
        }
    }

    /** Builds a request from a decoded line; empty when the value is not a JSON-RPC call. */
    public static Optional<JsonRpcRequest> from(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) return Optional.empty();
        JsonNode id = node.get("id");
        return Optional.of(new JsonRpcRequest(
                node.path("jsonrpc").asText("2.0"),
                id,
                method.asText(),
                node.get("params")));
    }

    /** Only a request without an {@code id} member is a notification; {@code "id": null} still gets a reply. */
    public boolean isNotification() {
        return id == null;
    }
}
