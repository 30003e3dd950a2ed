package io.github.drompincen.screencontrol.protocol.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

public record JsonRpcNotification(
        String jsonrpc,
        String method,
        @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode params
) {
    public static final String TOOLS_LIST_CHANGED = "notifications/tools/list_changed";

    public static JsonRpcNotification of(String method) {
        return new JsonRpcNotification(JsonRpcResponse.VERSION, method, null);
    }
}
