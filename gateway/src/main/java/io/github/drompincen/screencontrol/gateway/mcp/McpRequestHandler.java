package io.github.drompincen.screencontrol.gateway.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.protocol.api.ToolDefinition;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import io.github.drompincen.screencontrol.protocol.rpc.JsonRpcError;
import io.github.drompincen.screencontrol.protocol.rpc.JsonRpcNotification;
import io.github.drompincen.screencontrol.protocol.rpc.JsonRpcRequest;
import io.github.drompincen.screencontrol.protocol.rpc.JsonRpcResponse;
import io.github.drompincen.screencontrol.runtime.tools.ToolAvailability;
import io.github.drompincen.screencontrol.runtime.tools.ToolRegistry;
import io.github.drompincen.screencontrol.runtime.tools.ToolResult;
import io.github.drompincen.screencontrol.runtime.tools.ToolRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * JSON-RPC dispatch for one input line. {@code tools/call} runs on the tool executor, so
 * its response may complete after responses to later lines.
 */
public class McpRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(McpRequestHandler.class);

    private final ToolRouter router;
    private final ToolRegistry registry;
    private final ToolAvailability availability;
    private final ObjectMapper mapper;
    private final McpServerInfo serverInfo;
    private final Executor toolExecutor;

    public McpRequestHandler(ToolRouter router, ToolRegistry registry, ToolAvailability availability,
                             ObjectMapper mapper, McpServerInfo serverInfo, Executor toolExecutor) {
        this.router = router;
        this.registry = registry;
        this.availability = availability;
        this.mapper = mapper;
        this.serverInfo = serverInfo;
        this.toolExecutor = toolExecutor;
    }

    /** @return the response line, empty for notifications and blank input */
    public CompletableFuture<Optional<String>> handle(String line) {
        if (line == null || line.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable MCP line: {}", e.getOriginalMessage());
            return done(JsonRpcResponse.error(null, JsonRpcError.parseError()));
        }

        Optional<JsonRpcRequest> parsed = JsonRpcRequest.from(node);
        if (parsed.isEmpty()) {
            JsonNode id = node.isObject() ? node.get("id") : null;
            return done(JsonRpcResponse.error(id, JsonRpcError.invalidRequest()));
        }
        JsonRpcRequest request = parsed.get();
        if (request.method().startsWith("notifications/") || request.isNotification()) {
            log.debug("MCP notification {}", request.method());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return switch (request.method()) {
            case "initialize" -> done(JsonRpcResponse.result(request.id(), initializeResult()));
            case "tools/list" -> done(JsonRpcResponse.result(request.id(), toolList()));
            case "ping" -> done(JsonRpcResponse.result(request.id(), mapper.createObjectNode()));
            case "tools/call" -> callTool(request);
            default -> done(JsonRpcResponse.error(request.id(), JsonRpcError.methodNotFound()));
        };
    }

    /** The unsolicited frame sent when tool availability changes. */
    public String toolsListChanged() {
        return serialize(JsonRpcNotification.of(JsonRpcNotification.TOOLS_LIST_CHANGED));
    }

    private CompletableFuture<Optional<String>> callTool(JsonRpcRequest request) {
        String name = request.params().path("name").asText(null);
        if (name == null || name.isBlank()) {
            return done(JsonRpcResponse.error(request.id(), JsonRpcError.INVALID_PARAMS, "Missing tool name"));
        }
        ToolInvocation invocation = ToolInvocation.of(name, request.params().get("arguments"));
        return CompletableFuture
                .supplyAsync(() -> router.invoke(invocation), toolExecutor)
                .thenApply(result -> Optional.of(serialize(JsonRpcResponse.result(request.id(), toContent(result)))));
    }

    private ObjectNode initializeResult() {
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", serverInfo.protocolVersion());
        result.putObject("capabilities").putObject("tools").put("listChanged", true);
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", serverInfo.name());
        info.put("version", serverInfo.version());
        return result;
    }

    private ObjectNode toolList() {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolDefinition definition : registry.definitionsFor(availability.current())) {
            tools.add(definition.toMcpTool());
        }
        return result;
    }

    private ObjectNode toContent(ToolResult result) {
        ObjectNode content = mapper.createObjectNode();
        ObjectNode block = content.putArray("content").addObject();
        block.put("type", "text");
        if (result.success()) {
            JsonNode output = result.output() != null ? result.output() : mapper.createObjectNode().put("success", true);
            block.put("text", prettyPrint(output));
        } else {
            block.put("text", result.error());
            content.put("isError", true);
        }
        return content;
    }

    private String prettyPrint(JsonNode output) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(output);
        } catch (JsonProcessingException e) {
            log.error("Failed to render tool output", e);
            return output.toString();
        }
    }

    private CompletableFuture<Optional<String>> done(JsonRpcResponse response) {
        return CompletableFuture.completedFuture(Optional.of(serialize(response)));
    }

    private String serialize(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize MCP message", e);
            return "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":" + JsonRpcError.INTERNAL_ERROR
                    + ",\"message\":\"Internal error\"}}";
        }
    }
}
