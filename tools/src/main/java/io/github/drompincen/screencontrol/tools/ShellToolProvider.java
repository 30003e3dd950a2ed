package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;
import io.github.drompincen.screencontrol.runtime.shell.ExecResult;
import io.github.drompincen.screencontrol.runtime.shell.SessionOutput;
import io.github.drompincen.screencontrol.runtime.shell.SessionSnapshot;
import io.github.drompincen.screencontrol.runtime.shell.SessionStart;
import io.github.drompincen.screencontrol.runtime.shell.ShellSessionException;
import io.github.drompincen.screencontrol.runtime.shell.ShellSessionManager;
import io.github.drompincen.screencontrol.runtime.shell.StopResult;
import io.github.drompincen.screencontrol.runtime.tools.ToolProvider;
import io.github.drompincen.screencontrol.runtime.tools.ToolResult;

import java.util.Map;
import java.util.function.Function;

import static io.github.drompincen.screencontrol.tools.ToolArguments.bool;
import static io.github.drompincen.screencontrol.tools.ToolArguments.optionalInteger;
import static io.github.drompincen.screencontrol.tools.ToolArguments.stringMap;
import static io.github.drompincen.screencontrol.tools.ToolArguments.text;

/** Maps the {@code shell_*} tools onto {@link ShellSessionManager}. Output keys are snake_case. */
public class ShellToolProvider implements ToolProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ShellSessionManager sessions;
    private final Map<String, Function<JsonNode, ToolResult>> handlers;

    public ShellToolProvider(ShellSessionManager sessions) {
        this.sessions = sessions;
        this.handlers = Map.of(
                "shell_exec", this::exec,
                "shell_start_session", this::startSession,
                "shell_send_input", this::sendInput,
                "shell_stop_session", this::stopSession,
                "shell_list_sessions", args -> listSessions(),
                "shell_get_session", this::getSession,
                "shell_read_output", this::readOutput);
    }

    @Override
    public ToolCategory category() {
        return ToolCategory.SHELL;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        Function<JsonNode, ToolResult> handler = handlers.get(invocation.name());
        if (handler == null) {
            return ToolResult.failure("Unknown shell tool: " + invocation.name());
        }
        try {
            return handler.apply(invocation.arguments());
        } catch (ShellSessionException | IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
    }

    private ToolResult exec(JsonNode args) {
        Integer timeout = optionalInteger(args, "timeout_seconds");
        ExecResult result = sessions.run(text(args, "command"), text(args, "cwd"), timeout,
                bool(args, "capture_stderr", true));
        ObjectNode output = MAPPER.createObjectNode();
        output.put("exit_code", result.exitCode());
        output.put("stdout", result.stdout());
        output.put("stderr", result.stderr());
        output.put("truncated", result.truncated());
        output.put("duration_ms", result.durationMillis());
        if (result.timedOut()) {
            int effective = timeout == null || timeout <= 0 ? sessions.settings().defaultTimeoutSeconds() : timeout;
            output.put("timed_out", true);
            return ToolResult.failure("Command timeout after " + effective + " seconds", output);
        }
        return ToolResult.success(output);
    }

    private ToolResult startSession(JsonNode args) {
        SessionStart start = sessions.start(text(args, "command"), text(args, "cwd"), stringMap(args, "env"),
                bool(args, "capture_stderr", true));
        ObjectNode output = MAPPER.createObjectNode();
        output.put("session_id", start.sessionId());
        output.put("pid", start.pid());
        return ToolResult.success(output);
    }

    private ToolResult sendInput(JsonNode args) {
        String sessionId = text(args, "session_id");
        int written = sessions.sendInput(sessionId, text(args, "input"));
        ObjectNode output = MAPPER.createObjectNode();
        output.put("session_id", sessionId);
        output.put("bytes_written", written);
        return ToolResult.success(output);
    }

    private ToolResult stopSession(JsonNode args) {
        StopResult stop = sessions.stop(text(args, "session_id"), text(args, "signal"));
        ObjectNode output = MAPPER.createObjectNode();
        output.put("session_id", stop.sessionId());
        output.put("stopped", true);
        output.put("signal", stop.signal().name());
        output.put("exited", stop.exited());
        return ToolResult.success(output);
    }

    private ToolResult listSessions() {
        ObjectNode output = MAPPER.createObjectNode();
        ArrayNode list = output.putArray("sessions");
        sessions.listAll().forEach(s -> list.add(toJson(s)));
        output.put("count", list.size());
        return ToolResult.success(output);
    }

    private ToolResult getSession(JsonNode args) {
        String sessionId = text(args, "session_id");
        return sessions.describe(sessionId)
                .map(s -> ToolResult.success(toJson(s)))
                .orElseGet(() -> ToolResult.failure("Session " + sessionId + " not found"));
    }

    private ToolResult readOutput(JsonNode args) {
        SessionOutput out = sessions.readOutput(text(args, "session_id"));
        ObjectNode output = MAPPER.createObjectNode();
        output.put("session_id", out.sessionId());
        output.put("state", out.state().wireName());
        if (out.exitCode() != null) {
            output.put("exit_code", out.exitCode());
        }
        output.put("stdout", out.stdout());
        output.put("stderr", out.stderr());
        output.put("truncated", out.truncated());
        return ToolResult.success(output);
    }

    static ObjectNode toJson(SessionSnapshot s) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("session_id", s.sessionId());
        node.put("command", s.command());
        node.put("state", s.state().wireName());
        node.put("is_running", s.exitCode() == null);
        node.put("pid", s.pid());
        node.put("cwd", s.cwd());
        node.put("started_at", s.startedAt().toString());
        node.put("last_activity_at", s.lastActivityAt().toString());
        node.put("elapsed_ms", s.elapsedMillis());
        if (s.exitCode() != null) {
            node.put("exit_code", s.exitCode());
        }
        node.put("truncated", s.truncated());
        return node;
    }
}
