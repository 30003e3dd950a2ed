package io.github.drompincen.screencontrol.runtime.shell;

/** Outcome of a run-to-completion command. {@code exitCode} is -1 when the command timed out. */
public record ExecResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean truncated,
        boolean timedOut,
        long durationMillis
) {
}
