package io.github.drompincen.screencontrol.runtime.shell;

import java.time.Instant;

/** Copy of a session's metadata; never includes the buffered output. */
public record SessionSnapshot(
        String sessionId,
        String command,
        SessionState state,
        long pid,
        String cwd,
        Instant startedAt,
        Instant lastActivityAt,
        long elapsedMillis,
        Integer exitCode,
        boolean truncated
) {
}
