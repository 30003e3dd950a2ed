package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import io.github.drompincen.screencontrol.runtime.provider.AutomationProvider;
import io.github.drompincen.screencontrol.runtime.tools.ToolProvider;
import io.github.drompincen.screencontrol.runtime.tools.ToolResult;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import static io.github.drompincen.screencontrol.tools.ToolArguments.bool;
import static io.github.drompincen.screencontrol.tools.ToolArguments.integer;
import static io.github.drompincen.screencontrol.tools.ToolArguments.optionalInteger;
import static io.github.drompincen.screencontrol.tools.ToolArguments.text;

/** Everything without a category prefix: screen capture, pointer, keyboard and app control. */
public class AutomationToolProvider implements ToolProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final int MAX_WAIT_MILLIS = 60_000;

    private final AutomationProvider automation;
    private final Map<String, Function<JsonNode, JsonNode>> handlers = new HashMap<>();

    public AutomationToolProvider(AutomationProvider automation) {
        this.automation = automation;
        handlers.put("checkPermissions", args -> automation.checkPermissions());
        handlers.put("listApplications", args -> automation.listApplications());
        handlers.put("focusApplication", args -> automation.focusApplication(text(args, "identifier")));
        handlers.put("launchApplication", args -> automation.launchApplication(text(args, "identifier")));
        handlers.put("closeApp", args -> automation.closeApplication(text(args, "identifier"), bool(args, "force", false)));
        handlers.put("currentApp", args -> automation.currentApplication());
        handlers.put("screenshot", args -> image(automation.screenshot()));
        handlers.put("desktop_screenshot", args -> image(automation.screenshot()));
        handlers.put("screenshot_app", args -> image(automation.screenshotApplication(text(args, "identifier"))));
        handlers.put("click", args -> click(args, true));
        handlers.put("click_absolute", args -> click(args, false));
        handlers.put("doubleClick", args -> {
            automation.doubleClick(integer(args, "x", 0), integer(args, "y", 0));
            return at(args);
        });
        handlers.put("moveMouse", args -> {
            automation.moveMouse(integer(args, "x", 0), integer(args, "y", 0));
            return at(args);
        });
        handlers.put("getMousePosition", args -> automation.mousePosition());
        handlers.put("scroll", args -> {
            automation.scroll(integer(args, "deltaX", 0), integer(args, "deltaY", 0),
                    optionalInteger(args, "x"), optionalInteger(args, "y"));
            return ok();
        });
        handlers.put("scrollMouse", args -> {
            int amount = integer(args, "amount", 3);
            String direction = text(args, "direction", "down");
            if (!direction.equals("up") && !direction.equals("down")) {
                throw new IllegalArgumentException("direction must be 'up' or 'down'");
            }
            automation.scroll(0, direction.equals("up") ? -amount : amount, null, null);
            return ok();
        });
        handlers.put("drag", args -> {
            automation.drag(integer(args, "startX", 0), integer(args, "startY", 0),
                    integer(args, "endX", 0), integer(args, "endY", 0));
            return ok();
        });
        handlers.put("getClickableElements", args -> automation.clickableElements());
        handlers.put("getUIElements", args -> automation.uiElements());
        handlers.put("clickElement", args -> automation.clickElement(integer(args, "elementIndex", 0)));
        handlers.put("typeText", args -> {
            automation.typeText(text(args, "text"));
            return ok();
        });
        handlers.put("pressKey", args -> {
            automation.pressKey(text(args, "key"));
            return ok();
        });
        handlers.put("analyzeWithOCR", args -> automation.analyzeWithOcr());
        handlers.put("wait", this::waitFor);
    }

    @Override
    public ToolCategory category() {
        return ToolCategory.GUI;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        Function<JsonNode, JsonNode> handler = handlers.get(invocation.name());
        if (handler == null) {
            return ToolResult.failure("Unknown tool: " + invocation.name());
        }
        try {
            return ToolResult.success(handler.apply(invocation.arguments()));
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    private JsonNode click(JsonNode args, boolean relative) {
        automation.click(integer(args, "x", 0), integer(args, "y", 0), text(args, "button", "left"), relative);
        return at(args);
    }

    private JsonNode waitFor(JsonNode args) {
        int millis = integer(args, "milliseconds", 1000);
        if (millis < 0 || millis > MAX_WAIT_MILLIS) {
            throw new IllegalArgumentException("milliseconds must be between 0 and " + MAX_WAIT_MILLIS);
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Wait interrupted", e);
        }
        return MAPPER.createObjectNode().put("success", true).put("waited_ms", millis);
    }

    private static JsonNode image(byte[] png) {
        ObjectNode result = MAPPER.createObjectNode();
        result.put("format", "png");
        result.put("image", Base64.getEncoder().encodeToString(png));
        return result;
    }

    private static JsonNode at(JsonNode args) {
        return ok().put("x", integer(args, "x", 0)).put("y", integer(args, "y", 0));
    }

    private static ObjectNode ok() {
        return MAPPER.createObjectNode().put("success", true);
    }
}
