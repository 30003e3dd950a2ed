package io.github.drompincen.screencontrol.gateway.http;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;

import java.util.Map;
import java.util.Optional;

/** Maps request paths onto tool names. */
final class HttpRouteTable {

    private static final Map<String, String> FIXED = Map.of(
            "/permissions", "checkPermissions",
            "/shell/exec", "shell_exec",
            "/shell/start_session", "shell_start_session",
            "/shell/send_input", "shell_send_input",
            "/shell/stop_session", "shell_stop_session",
            "/shell/sessions", "shell_list_sessions",
            "/shell/session", "shell_get_session",
            "/shell/output", "shell_read_output");

    private HttpRouteTable() {
    }

    static Optional<String> toolName(String path) {
        String fixed = FIXED.get(path);
        if (fixed != null) {
            return Optional.of(fixed);
        }
        if (path.startsWith("/fs/")) {
            return segment(path, "/fs/").map(op -> "fs_" + op);
        }
        if (path.startsWith("/browser/")) {
            return segment(path, "/browser/").map(action -> "browser_" + action);
        }
        return segment(path, "/").filter(name -> ToolCategory.forToolName(name) == ToolCategory.GUI);
    }

    private static Optional<String> segment(String path, String prefix) {
        String rest = path.substring(prefix.length());
        if (rest.isEmpty() || rest.contains("/")) {
            return Optional.empty();
        }
        return Optional.of(rest);
    }
}
