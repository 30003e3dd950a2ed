package io.github.drompincen.screencontrol.protocol.rpc;

public record JsonRpcError(
        int code,
        String message
) {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    public static JsonRpcError parseError() { return new JsonRpcError(PARSE_ERROR, "Parse error"); }

    public static JsonRpcError invalidRequest() { return new JsonRpcError(INVALID_REQUEST, "Invalid Request"); }

    public static JsonRpcError methodNotFound() { return new JsonRpcError(METHOD_NOT_FOUND, "Method not found"); }
}
