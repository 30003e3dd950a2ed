package io.github.drompincen.screencontrol.gateway.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.protocol.api.ToolDefinition;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import io.github.drompincen.screencontrol.runtime.tools.ToolAvailability;
import io.github.drompincen.screencontrol.runtime.tools.ToolRegistry;
import io.github.drompincen.screencontrol.runtime.tools.ToolResult;
import io.github.drompincen.screencontrol.runtime.tools.ToolRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Turns a parsed request into a response: preflight and health checks first, then bearer
 * authentication, then dispatch through the {@link ToolRouter}.
 */
public class HttpRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestHandler.class);

    private final ToolRouter router;
    private final ToolRegistry registry;
    private final ToolAvailability availability;
    private final ObjectMapper mapper;
    private final byte[] expectedAuthorization;
    private final String version;

    public HttpRequestHandler(ToolRouter router, ToolRegistry registry, ToolAvailability availability,
                              ObjectMapper mapper, String apiKey, String version) {
        this.router = router;
        this.registry = registry;
        this.availability = availability;
        this.mapper = mapper;
        this.expectedAuthorization = ("Bearer " + apiKey).getBytes(StandardCharsets.UTF_8);
        this.version = version;
    }

    public HttpResponse handle(HttpRequest request) {
        if ("OPTIONS".equals(request.method())) {
            return HttpResponse.empty(200);
        }
        if ("GET".equals(request.method()) && "/health".equals(request.path())) {
            ObjectNode health = mapper.createObjectNode();
            health.put("status", "ok");
            health.put("version", version);
            return respond(200, health);
        }
        if (!authorized(request.header("Authorization"))) {
            log.debug("Rejected unauthenticated {} {}", request.method(), request.path());
            return error(401, "Unauthorized");
        }

        JsonNode body = parseBody(request.body());
        if ("/tools/list".equals(request.path())) {
            return respond(200, toolList());
        }
        if ("/tools/call".equals(request.path())) {
            String name = body.path("name").asText(null);
            if (name == null || name.isBlank()) {
                return error(400, "Missing tool name");
            }
            return invoke(ToolInvocation.of(name, body.get("arguments")));
        }

        Optional<String> toolName = HttpRouteTable.toolName(request.path())
                .filter(name -> registry.describe(name).isPresent());
        if (toolName.isEmpty()) {
            ObjectNode notFound = mapper.createObjectNode();
            notFound.put("error", "Not found");
            notFound.put("path", request.path());
            return respond(404, notFound);
        }
        return invoke(ToolInvocation.of(toolName.get(), body));
    }

    private HttpResponse invoke(ToolInvocation invocation) {
        log.debug("HTTP tool call {}", invocation.name());
        ToolResult result = router.invoke(invocation);
        if (result.success()) {
            JsonNode output = result.output() != null ? result.output() : mapper.createObjectNode().put("success", true);
            return respond(200, output);
        }
        ObjectNode failure = mapper.createObjectNode();
        failure.put("error", result.error());
        if (result.output() instanceof ObjectNode partial) {
            partial.fields().forEachRemaining(field -> {
                if (!"error".equals(field.getKey())) {
                    failure.set(field.getKey(), field.getValue());
                }
            });
        }
        return respond(400, failure);
    }

    private ObjectNode toolList() {
        ObjectNode list = mapper.createObjectNode();
        ArrayNode tools = list.putArray("tools");
        for (ToolDefinition definition : registry.definitionsFor(availability.current())) {
            tools.add(definition.toMcpTool());
        }
        return list;
    }

    private boolean authorized(String header) {
        if (header == null) {
            return false;
        }
        return MessageDigest.isEqual(expectedAuthorization, header.trim().getBytes(StandardCharsets.UTF_8));
    }

    /** Empty or non-JSON bodies become an empty argument map. */
    private JsonNode parseBody(byte[] body) {
        if (body.length == 0) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(body);
            return node != null && node.isObject() ? node : mapper.createObjectNode();
        } catch (IOException e) {
            log.debug("Ignoring non-JSON request body: {}", e.getMessage());
            return mapper.createObjectNode();
        }
    }

    private HttpResponse error(int status, String message) {
        return respond(status, mapper.createObjectNode().put("error", message));
    }

    private HttpResponse respond(int status, JsonNode body) {
        try {
            return HttpResponse.json(status, mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize response", e);
            return HttpResponse.json(500, "{\"error\":\"Failed to serialize response\"}");
        }
    }
}
