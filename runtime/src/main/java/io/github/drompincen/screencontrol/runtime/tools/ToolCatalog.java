package io.github.drompincen.screencontrol.runtime.tools;

import io.github.drompincen.screencontrol.protocol.api.ParameterSpec;
import io.github.drompincen.screencontrol.protocol.api.ToolDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed table of every tool the agent knows about, in advertisement order:
 * gui, filesystem, shell, browser.
 */
public final class ToolCatalog {

    private static final List<ToolDefinition> DEFINITIONS = build();

    private ToolCatalog() {
    }

    public static List<ToolDefinition> definitions() {
        return DEFINITIONS;
    }

    private static List<ToolDefinition> build() {
        List<ToolDefinition> defs = new ArrayList<>();
        gui(defs);
        filesystem(defs);
        shell(defs);
        browser(defs);
        return Collections.unmodifiableList(defs);
    }

    private static void gui(List<ToolDefinition> defs) {
        defs.add(tool("listApplications", "List running applications").build());
        defs.add(tool("focusApplication", "Focus an application").param("identifier", appIdentifier()).required("identifier").build());
        defs.add(tool("launchApplication", "Launch an application").param("identifier", appIdentifier()).required("identifier").build());
        defs.add(tool("closeApp", "Close an application")
                .param("identifier", appIdentifier())
                .param("force", ParameterSpec.bool("Force quit the app"))
                .required("identifier").build());
        defs.add(tool("currentApp", "Get current focused application").build());
        defs.add(tool("screenshot", "Take a screenshot of the entire desktop").build());
        defs.add(tool("desktop_screenshot", "Take a screenshot of the entire desktop").build());
        defs.add(tool("screenshot_app", "Take a screenshot of a specific application window").param("identifier", appIdentifier()).build());
        defs.add(pointer("click", "Click at coordinates relative to current app", true));
        defs.add(pointer("click_absolute", "Click at absolute screen coordinates", true));
        defs.add(pointer("doubleClick", "Double-click at coordinates", false));
        defs.add(tool("clickElement", "Click a UI element by index")
                .param("elementIndex", ParameterSpec.number("Index of element to click"))
                .required("elementIndex").build());
        defs.add(pointer("moveMouse", "Move mouse to coordinates", false));
        defs.add(tool("getMousePosition", "Get current mouse position").build());
        defs.add(tool("scroll", "Scroll with delta values")
                .param("deltaX", ParameterSpec.number("Horizontal scroll amount"))
                .param("deltaY", ParameterSpec.number("Vertical scroll amount"))
                .param("x", ParameterSpec.number("X coordinate (optional)"))
                .param("y", ParameterSpec.number("Y coordinate (optional)"))
                .build());
        defs.add(tool("scrollMouse", "Scroll up or down")
                .param("direction", ParameterSpec.oneOf("Scroll direction", "up", "down"))
                .param("amount", ParameterSpec.number("Scroll amount (default: 3)"))
                .required("direction").build());
        defs.add(tool("drag", "Drag from one point to another")
                .param("startX", ParameterSpec.number("Start X coordinate"))
                .param("startY", ParameterSpec.number("Start Y coordinate"))
                .param("endX", ParameterSpec.number("End X coordinate"))
                .param("endY", ParameterSpec.number("End Y coordinate"))
                .required("startX", "startY", "endX", "endY").build());
        defs.add(tool("getClickableElements", "Get list of clickable UI elements").build());
        defs.add(tool("getUIElements", "Get all UI elements").build());
        defs.add(tool("typeText", "Type text using keyboard").param("text", ParameterSpec.string("Text to type")).required("text").build());
        defs.add(tool("pressKey", "Press a specific key")
                .param("key", ParameterSpec.string("Key to press (e.g., 'enter', 'tab', 'escape')"))
                .required("key").build());
        defs.add(tool("analyzeWithOCR", "Analyze screen with OCR").build());
        defs.add(tool("checkPermissions", "Check accessibility permissions").build());
        defs.add(tool("wait", "Wait for specified milliseconds")
                .param("milliseconds", ParameterSpec.number("Time to wait in milliseconds")).build());
    }

    private static void filesystem(List<ToolDefinition> defs) {
        defs.add(fs("fs_list", "List directory contents")
                .param("recursive", ParameterSpec.bool("List subdirectories recursively"))
                .param("max_depth", ParameterSpec.number("Maximum directory depth"))
                .required("path").build());
        defs.add(fs("fs_read", "Read a file")
                .param("max_bytes", ParameterSpec.number("Maximum bytes to read (default: 131072)"))
                .required("path").build());
        defs.add(fs("fs_read_range", "Read specific lines from a file")
                .param("start_line", ParameterSpec.number("Starting line number"))
                .param("end_line", ParameterSpec.number("Ending line number"))
                .required("path").build());
        defs.add(fs("fs_write", "Write to a file")
                .param("content", ParameterSpec.string("Content to write"))
                .param("create_directories", ParameterSpec.bool("Create parent directories if needed"))
                .param("mode", ParameterSpec.oneOf("Write mode", "overwrite", "append"))
                .required("path", "content").build());
        defs.add(fs("fs_delete", "Delete a file or directory")
                .param("recursive", ParameterSpec.bool("Recursively delete directories"))
                .required("path").build());
        defs.add(tool("fs_move", "Move/rename a file")
                .param("source", ParameterSpec.string("Source path"))
                .param("destination", ParameterSpec.string("Destination path"))
                .required("source", "destination").build());
        defs.add(fs("fs_search", "Search for files by pattern")
                .param("pattern", ParameterSpec.string("Search pattern (glob)"))
                .param("max_results", ParameterSpec.number("Maximum number of results (default: 200)"))
                .required("path", "pattern").build());
        defs.add(fs("fs_grep", "Search file contents")
                .param("pattern", ParameterSpec.string("Search pattern (regex)"))
                .param("glob", ParameterSpec.string("Only search files matching this glob"))
                .param("case_sensitive", ParameterSpec.bool("Case sensitive search"))
                .param("max_matches", ParameterSpec.number("Maximum number of matches (default: 200)"))
                .required("path", "pattern").build());
        defs.add(fs("fs_patch", "Apply patches to a file")
                .param("operations", ParameterSpec.of("array", "Patch operations"))
                .param("dry_run", ParameterSpec.bool("Preview changes without applying"))
                .required("path", "operations").build());
    }

    private static void shell(List<ToolDefinition> defs) {
        defs.add(tool("shell_exec", "Execute a shell command")
                .param("command", ParameterSpec.string("Command to execute"))
                .param("cwd", ParameterSpec.string("Working directory"))
                .param("timeout_seconds", ParameterSpec.number("Timeout in seconds"))
                .param("capture_stderr", ParameterSpec.bool("Capture stderr"))
                .required("command").build());
        defs.add(tool("shell_start_session", "Start an interactive shell session")
                .param("command", ParameterSpec.string("Command to start"))
                .param("cwd", ParameterSpec.string("Working directory"))
                .param("env", ParameterSpec.of("object", "Environment variables"))
                .param("capture_stderr", ParameterSpec.bool("Capture stderr"))
                .required("command").build());
        defs.add(tool("shell_send_input", "Send input to a shell session")
                .param("session_id", sessionId())
                .param("input", ParameterSpec.string("Input to send"))
                .required("session_id", "input").build());
        defs.add(tool("shell_stop_session", "Stop a shell session")
                .param("session_id", sessionId())
                .param("signal", ParameterSpec.string("Signal to send (default: TERM)"))
                .required("session_id").build());
        defs.add(tool("shell_list_sessions", "List active shell sessions").build());
        defs.add(tool("shell_get_session", "Get details of a shell session")
                .param("session_id", sessionId())
                .required("session_id").build());
        defs.add(tool("shell_read_output", "Read and clear the buffered output of a shell session")
                .param("session_id", sessionId())
                .required("session_id").build());
    }

    private static void browser(List<ToolDefinition> defs) {
        Map<String, String> descriptions = new LinkedHashMap<>();
        descriptions.put("browser_navigate", "Navigate browser to a URL");
        descriptions.put("browser_screenshot", "Take a browser screenshot");
        descriptions.put("browser_getVisibleText", "Get visible text from a tab (use 'url' parameter to target background tab without switching)");
        descriptions.put("browser_searchVisibleText", "Search for text in a tab");
        descriptions.put("browser_clickElement", "Click an element in the browser");
        descriptions.put("browser_fillElement", "Fill a form field");
        descriptions.put("browser_getTabs", "Get list of open tabs");
        descriptions.put("browser_getActiveTab", "Get the active tab");
        descriptions.put("browser_focusTab", "Focus a specific tab");
        descriptions.put("browser_createTab", "Create a new tab");
        descriptions.put("browser_closeTab", "Close a tab");
        descriptions.put("browser_go_back", "Navigate back");
        descriptions.put("browser_go_forward", "Navigate forward");
        descriptions.put("browser_get_visible_html", "Get page HTML");
        descriptions.put("browser_executeScript", "Execute JavaScript");
        descriptions.put("browser_listConnected", "List connected browsers");

        List<String> names = List.of(
                "browser_listConnected", "browser_setDefaultBrowser",
                "browser_getTabs", "browser_getActiveTab", "browser_focusTab",
                "browser_createTab", "browser_closeTab", "browser_getPageInfo",
                "browser_inspectCurrentPage", "browser_getInteractiveElements",
                "browser_getPageContext", "browser_clickElement", "browser_fillElement",
                "browser_fillFormField", "browser_fillWithFallback", "browser_fillFormNative",
                "browser_scrollTo", "browser_executeScript", "browser_getFormData",
                "browser_setWatchMode", "browser_getVisibleText", "browser_searchVisibleText",
                "browser_getUIElements", "browser_waitForSelector", "browser_waitForPageLoad",
                "browser_selectOption", "browser_isElementVisible", "browser_getConsoleLogs",
                "browser_getNetworkRequests", "browser_getLocalStorage", "browser_getCookies",
                "browser_clickByText", "browser_clickMultiple", "browser_getFormStructure",
                "browser_answerQuestions", "browser_getDropdownOptions", "browser_openDropdownNative",
                "browser_listInteractiveElements", "browser_clickElementWithDebug",
                "browser_findElementWithDebug", "browser_findTabByUrl",
                "browser_navigate", "browser_screenshot", "browser_go_back",
                "browser_go_forward", "browser_get_visible_html", "browser_hover",
                "browser_drag", "browser_press_key", "browser_upload_file", "browser_save_as_pdf");

        for (String name : names) {
            Builder b = tool(name, descriptions.getOrDefault(name, "Execute " + name + " tool"))
                    .param("browser", ParameterSpec.string("Target browser (chrome, firefox, safari, edge)"));
            switch (name) {
                case "browser_navigate" -> b.param("url", ParameterSpec.string("URL to navigate to")).required("url");
                case "browser_getVisibleText", "browser_getUIElements" -> tabTarget(b);
                case "browser_searchVisibleText" -> tabTarget(b).param("query", ParameterSpec.string("Text to search for"));
                case "browser_clickElement" -> tabTarget(b)
                        .param("selector", ParameterSpec.string("CSS selector"))
                        .param("text", ParameterSpec.string("Text content to find"));
                case "browser_fillElement" -> tabTarget(b)
                        .param("selector", ParameterSpec.string("CSS selector"))
                        .param("value", ParameterSpec.string("Value to fill"))
                        .required("selector", "value");
                case "browser_executeScript" -> b.param("script", ParameterSpec.string("JavaScript to execute"));
                case "browser_focusTab", "browser_closeTab" -> b.param("tabId", ParameterSpec.number("Tab ID"));
                case "browser_createTab" -> b.param("url", ParameterSpec.string("URL for new tab"));
                default -> { }
            }
            defs.add(b.build());
        }
    }

    private static Builder tabTarget(Builder b) {
        return b.param("url", ParameterSpec.string("URL of tab to target (without switching)"))
                .param("tabId", ParameterSpec.number("Tab ID (optional, url preferred)"));
    }

    private static ToolDefinition pointer(String name, String description, boolean withButton) {
        Builder b = tool(name, description)
                .param("x", ParameterSpec.number("X coordinate"))
                .param("y", ParameterSpec.number("Y coordinate"));
        if (withButton) {
            b.param("button", ParameterSpec.oneOf("Mouse button", "left", "right"));
        }
        return b.required("x", "y").build();
    }

    private static Builder fs(String name, String description) {
        return tool(name, description).param("path", ParameterSpec.string("File or directory path"));
    }

    private static ParameterSpec appIdentifier() {
        return ParameterSpec.string("App bundle ID or name");
    }

    private static ParameterSpec sessionId() {
        return ParameterSpec.string("Session ID");
    }

    private static Builder tool(String name, String description) {
        return new Builder(name, description);
    }

    private static final class Builder {
        private final String name;
        private final String description;
        private final Map<String, ParameterSpec> params = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();

        private Builder(String name, String description) {
            this.name = name;
            this.description = description;
        }

        Builder param(String paramName, ParameterSpec spec) {
            params.put(paramName, spec);
            return this;
        }

        Builder required(String... names) {
            required.addAll(List.of(names));
            return this;
        }

        ToolDefinition build() {
            return new ToolDefinition(name, description, params, required, null);
        }
    }
}
