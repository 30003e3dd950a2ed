package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.runtime.provider.AutomationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.AWTException;
import java.awt.GraphicsDevice;
import java.awt.GraphicsEnvironment;
import java.awt.MouseInfo;
import java.awt.Point;
import java.awt.PointerInfo;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pointer, keyboard and screen capture through {@link Robot}. There is no portable
 * accessibility API in the JDK, so application management, element enumeration and OCR
 * are reported as unsupported.
 */
public class RobotAutomationProvider implements AutomationProvider {

    private static final Logger log = LoggerFactory.getLogger(RobotAutomationProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DRAG_STEPS = 10;

    private static final Map<String, Integer> NAMED_KEYS = Map.ofEntries(
            Map.entry("enter", KeyEvent.VK_ENTER),
            Map.entry("return", KeyEvent.VK_ENTER),
            Map.entry("tab", KeyEvent.VK_TAB),
            Map.entry("escape", KeyEvent.VK_ESCAPE),
            Map.entry("esc", KeyEvent.VK_ESCAPE),
            Map.entry("backspace", KeyEvent.VK_BACK_SPACE),
            Map.entry("delete", KeyEvent.VK_DELETE),
            Map.entry("space", KeyEvent.VK_SPACE),
            Map.entry("up", KeyEvent.VK_UP),
            Map.entry("down", KeyEvent.VK_DOWN),
            Map.entry("left", KeyEvent.VK_LEFT),
            Map.entry("right", KeyEvent.VK_RIGHT),
            Map.entry("home", KeyEvent.VK_HOME),
            Map.entry("end", KeyEvent.VK_END),
            Map.entry("pageup", KeyEvent.VK_PAGE_UP),
            Map.entry("pagedown", KeyEvent.VK_PAGE_DOWN),
            Map.entry("ctrl", KeyEvent.VK_CONTROL),
            Map.entry("control", KeyEvent.VK_CONTROL),
            Map.entry("shift", KeyEvent.VK_SHIFT),
            Map.entry("alt", KeyEvent.VK_ALT),
            Map.entry("option", KeyEvent.VK_ALT),
            Map.entry("cmd", KeyEvent.VK_META),
            Map.entry("command", KeyEvent.VK_META),
            Map.entry("meta", KeyEvent.VK_META));

    private Robot robot;

    private synchronized Robot robot() {
        if (GraphicsEnvironment.isHeadless()) {
            throw new UnsupportedOperationException("Screen automation is not available in a headless environment");
        }
        if (robot == null) {
            try {
                robot = new Robot();
                robot.setAutoDelay(10);
            } catch (AWTException e) {
                throw new UnsupportedOperationException("Screen automation is not available: " + e.getMessage(), e);
            }
        }
        return robot;
    }

    private static UnsupportedOperationException unsupported(String operation) {
        return new UnsupportedOperationException(operation + " is not supported on this platform");
    }

    @Override
    public JsonNode checkPermissions() {
        boolean headless = GraphicsEnvironment.isHeadless();
        ObjectNode result = MAPPER.createObjectNode();
        result.put("platform", System.getProperty("os.name"));
        result.put("screen_capture", !headless);
        result.put("input", !headless);
        result.put("accessibility", false);
        return result;
    }

    @Override
    public JsonNode listApplications() {
        throw unsupported("listApplications");
    }

    @Override
    public JsonNode focusApplication(String identifier) {
        throw unsupported("focusApplication");
    }

    @Override
    public JsonNode launchApplication(String identifier) {
        throw unsupported("launchApplication");
    }

    @Override
    public JsonNode closeApplication(String identifier, boolean force) {
        throw unsupported("closeApp");
    }

    @Override
    public JsonNode currentApplication() {
        throw unsupported("currentApp");
    }

    @Override
    public byte[] screenshot() {
        Robot r = robot();
        Rectangle bounds = new Rectangle();
        for (GraphicsDevice device : GraphicsEnvironment.getLocalGraphicsEnvironment().getScreenDevices()) {
            bounds = bounds.union(device.getDefaultConfiguration().getBounds());
        }
        return png(r.createScreenCapture(bounds));
    }

    @Override
    public byte[] screenshotApplication(String identifier) {
        throw unsupported("screenshot_app");
    }

    // No window geometry is available, so coordinates relative to the app are treated as absolute.
    @Override
    public void click(int x, int y, String button, boolean relativeToApp) {
        Robot r = robot();
        int mask = "right".equalsIgnoreCase(button) ? InputEvent.BUTTON3_DOWN_MASK : InputEvent.BUTTON1_DOWN_MASK;
        r.mouseMove(x, y);
        r.mousePress(mask);
        r.mouseRelease(mask);
    }

    @Override
    public void doubleClick(int x, int y) {
        click(x, y, "left", false);
        click(x, y, "left", false);
    }

    @Override
    public void moveMouse(int x, int y) {
        robot().mouseMove(x, y);
    }

    @Override
    public JsonNode mousePosition() {
        robot();
        PointerInfo info = MouseInfo.getPointerInfo();
        if (info == null) {
            throw new UnsupportedOperationException("Pointer position is not available");
        }
        Point location = info.getLocation();
        ObjectNode result = MAPPER.createObjectNode();
        result.put("x", location.x);
        result.put("y", location.y);
        return result;
    }

    @Override
    public void scroll(int deltaX, int deltaY, Integer x, Integer y) {
        Robot r = robot();
        if (x != null && y != null) {
            r.mouseMove(x, y);
        }
        if (deltaY != 0) {
            r.mouseWheel(deltaY);
        }
        if (deltaX != 0) {
            r.keyPress(KeyEvent.VK_SHIFT);
            try {
                r.mouseWheel(deltaX);
            } finally {
                r.keyRelease(KeyEvent.VK_SHIFT);
            }
        }
    }

    @Override
    public void drag(int startX, int startY, int endX, int endY) {
        Robot r = robot();
        r.mouseMove(startX, startY);
        r.mousePress(InputEvent.BUTTON1_DOWN_MASK);
        try {
            for (int i = 1; i <= DRAG_STEPS; i++) {
                r.mouseMove(startX + (endX - startX) * i / DRAG_STEPS, startY + (endY - startY) * i / DRAG_STEPS);
            }
        } finally {
            r.mouseRelease(InputEvent.BUTTON1_DOWN_MASK);
        }
    }

    @Override
    public void typeText(String text) {
        Robot r = robot();
        for (char c : text.toCharArray()) {
            int code = KeyEvent.getExtendedKeyCodeForChar(c);
            if (code == KeyEvent.VK_UNDEFINED) {
                throw new IllegalArgumentException("Cannot type character '" + c + "'");
            }
            boolean shift = Character.isUpperCase(c);
            if (shift) {
                r.keyPress(KeyEvent.VK_SHIFT);
            }
            try {
                r.keyPress(code);
                r.keyRelease(code);
            } finally {
                if (shift) {
                    r.keyRelease(KeyEvent.VK_SHIFT);
                }
            }
        }
    }

    /** Accepts a single key name or a combination such as {@code cmd+shift+t}. */
    @Override
    public void pressKey(String key) {
        List<Integer> codes = new ArrayList<>();
        for (String part : key.toLowerCase(Locale.ROOT).split("\\+")) {
            codes.add(keyCode(part.trim()));
        }
        Robot r = robot();
        for (int code : codes) {
            r.keyPress(code);
        }
        for (int i = codes.size() - 1; i >= 0; i--) {
            r.keyRelease(codes.get(i));
        }
        log.debug("Pressed {}", key);
    }

    static int keyCode(String name) {
        Integer named = NAMED_KEYS.get(name);
        if (named != null) {
            return named;
        }
        if (name.matches("f([1-9]|1[0-2])")) {
            return KeyEvent.VK_F1 + Integer.parseInt(name.substring(1)) - 1;
        }
        if (name.length() == 1) {
            int code = KeyEvent.getExtendedKeyCodeForChar(name.charAt(0));
            if (code != KeyEvent.VK_UNDEFINED) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown key: " + name);
    }

    @Override
    public JsonNode clickableElements() {
        throw unsupported("getClickableElements");
    }

    @Override
    public JsonNode uiElements() {
        throw unsupported("getUIElements");
    }

    @Override
    public JsonNode clickElement(int elementIndex) {
        throw unsupported("clickElement");
    }

    @Override
    public JsonNode analyzeWithOcr() {
        throw unsupported("analyzeWithOCR");
    }

    private static byte[] png(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode screenshot", e);
        }
        return out.toByteArray();
    }
}
