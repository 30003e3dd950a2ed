package io.github.drompincen.screencontrol.runtime.shell;

/** Output drained by one read. {@code exitCode} is set once the session has ended. */
public record SessionOutput(
        String sessionId,
        SessionState state,
        Integer exitCode,
        String stdout,
        String stderr,
        boolean truncated
) {
}
