package io.github.drompincen.screencontrol.runtime.shell;

import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One spawned child process and its retained output. Every mutable field is guarded by
 * the owning {@link ShellSessionManager}'s lock; instances never leave the package.
 */
final class ShellSession {

    final String id;
    final String command;
    final Path cwd;
    final Process process;
    final OutputStream stdin;
    final Instant startedAt;
    final CompletableFuture<Void> finished = new CompletableFuture<>();
    // tail of the stdin write chain; each write runs after the previous one
    CompletableFuture<Void> pendingInput = CompletableFuture.completedFuture(null);

    final OutputBuffer stdout = new OutputBuffer();
    final OutputBuffer stderr = new OutputBuffer();
    SessionState state = SessionState.STARTING;
    boolean truncated;
    boolean stopRequested;
    Integer exitCode;
    Instant lastActivityAt;
    Instant endedAt;

    ShellSession(String id, String command, Path cwd, Process process) {
        this.id = id;
        this.command = command;
        this.cwd = cwd;
        this.process = process;
        this.stdin = process.getOutputStream();
        this.startedAt = Instant.now();
        this.lastActivityAt = startedAt;
    }

    /** Appends a chunk and trims the combined retained output back to {@code cap} bytes. */
    void append(boolean toStdout, byte[] chunk, int length, int cap) {
        OutputBuffer target = toStdout ? stdout : stderr;
        OutputBuffer other = toStdout ? stderr : stdout;
        target.append(chunk, 0, length);
        int excess = target.size() + other.size() - cap;
        if (excess > 0) {
            excess -= target.dropOldest(excess);
            if (excess > 0) {
                other.dropOldest(excess);
            }
            truncated = true;
        }
        lastActivityAt = Instant.now();
    }

    boolean isTerminal() {
        return state == SessionState.EXITED || state == SessionState.STOPPED;
    }

    SessionSnapshot snapshot() {
        return new SessionSnapshot(id, command, state, process.pid(), cwd.toString(), startedAt, lastActivityAt,
                Duration.between(startedAt, Instant.now()).toMillis(), exitCode, truncated);
    }
}
