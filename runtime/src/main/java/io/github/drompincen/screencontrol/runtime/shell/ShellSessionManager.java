package io.github.drompincen.screencontrol.runtime.shell;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every child process started by the shell tools.
 * <p>
 * Both run-to-completion commands and long-lived sessions go through {@link #spawn}.
 * All session state (the table, each session's buffers, state and exit code) is read
 * and written only while holding {@code lock}; output pumps run on the
 * {@code shell-stream} executor and take the same lock for every chunk they append.
 * Stdin writes are chained per session on the same executor, so a child that stops
 * reading never blocks the caller or the lock.
 * <p>
 * A session that exits on its own stays in the table, with its exit code and remaining
 * output, until one read drains it or it has been ended for {@code EXITED_RETENTION}.
 */
@Service
public class ShellSessionManager {

    private static final Logger log = LoggerFactory.getLogger(ShellSessionManager.class);
    private static final int CHUNK_SIZE = 8192;
    private static final long PUMP_DRAIN_MILLIS = 2000;
    private static final long INPUT_WAIT_MILLIS = 1000;
    private static final Duration EXITED_RETENTION = Duration.ofMinutes(5);

    private final ShellSettings settings;
    private final Object lock = new Object();
    private final Map<String, ShellSession> sessions = new LinkedHashMap<>();
    // exec runs and stopped-but-not-yet-exited sessions; terminated by cleanupAll
    private final Set<ShellSession> untracked = new HashSet<>();
    private final AtomicLong idCounter = new AtomicLong();
    private final ExecutorService streamExecutor;
    private int pendingStarts;
    private boolean closed;

    public ShellSessionManager(ShellSettings settings) {
        this.settings = settings;
        this.streamExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "shell-stream");
            t.setDaemon(true);
            return t;
        });
    }

    public ShellSettings settings() {
        return settings;
    }

    /**
     * Runs a command to completion, blocking the caller until it exits or the timeout
     * elapses. A timed-out command is killed together with its descendants and reported
     * with whatever output it produced.
     */
    public ExecResult run(String command, String cwd, Integer timeoutSeconds, boolean captureStderr) {
        int timeout = timeoutSeconds == null || timeoutSeconds <= 0 ? settings.defaultTimeoutSeconds() : timeoutSeconds;
        synchronized (lock) {
            ensureOpen();
        }
        ShellSession session = spawn("exec_" + System.currentTimeMillis() + "_" + idCounter.incrementAndGet(),
                command, cwd, Map.of(), captureStderr, true);
        synchronized (lock) {
            if (!session.isTerminal()) {
                session.state = SessionState.RUNNING;
                untracked.add(session);
            }
        }

        boolean timedOut = false;
        try {
            if (!session.process.waitFor(timeout, TimeUnit.SECONDS)) {
                timedOut = true;
                log.warn("Command timed out after {}s, killing pid {}: {}", timeout, session.process.pid(), command);
                ShellSignal.destroyTree(session.process);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ShellSignal.destroyTree(session.process);
            throw new ShellSessionException("Interrupted while waiting for command", e);
        }
        awaitFinished(session, PUMP_DRAIN_MILLIS * 2);

        synchronized (lock) {
            untracked.remove(session);
            int exitCode = timedOut || session.exitCode == null ? -1 : session.exitCode;
            long duration = System.currentTimeMillis() - session.startedAt.toEpochMilli();
            return new ExecResult(exitCode, session.stdout.text(), session.stderr.text(),
                    session.truncated, timedOut, duration);
        }
    }

    public SessionStart start(String command, String cwd, Map<String, String> env, boolean captureStderr) {
        synchronized (lock) {
            ensureOpen();
            pruneExited();
            if (liveSessions() + pendingStarts >= settings.maxSessions()) {
                throw new ShellSessionException("Maximum concurrent sessions (" + settings.maxSessions() + ") reached");
            }
            pendingStarts++;
        }

        ShellSession session;
        try {
            session = spawn("session_" + System.currentTimeMillis() + "_" + idCounter.incrementAndGet(),
                    command, cwd, env, captureStderr, false);
        } finally {
            synchronized (lock) {
                pendingStarts--;
            }
        }

        synchronized (lock) {
            if (!session.isTerminal()) {
                session.state = SessionState.RUNNING;
            }
            sessions.put(session.id, session);
        }
        log.info("Started shell session {} (pid {}): {}", session.id, session.process.pid(), command);
        return new SessionStart(session.id, session.process.pid());
    }

    /**
     * Queues {@code input} for the session's stdin and returns its length in bytes.
     * Waits up to {@code INPUT_WAIT_MILLIS} for the write to complete so that a broken
     * pipe is reported to the caller; a write still blocked after that keeps going in
     * the background, ahead of any later input.
     */
    public int sendInput(String sessionId, String input) {
        byte[] bytes = input.getBytes(StandardCharsets.UTF_8);
        ShellSession session;
        CompletableFuture<Void> write;
        synchronized (lock) {
            session = sessions.get(sessionId);
            if (session == null) {
                throw ShellSessionException.notFound(sessionId);
            }
            if (session.state != SessionState.RUNNING || session.stopRequested) {
                throw ShellSessionException.notRunning(sessionId);
            }
            ShellSession target = session;
            write = session.pendingInput.thenRunAsync(() -> writeInput(target, bytes), streamExecutor);
            session.pendingInput = write;
            session.lastActivityAt = Instant.now();
        }

        try {
            write.get(INPUT_WAIT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Input of {} bytes to {} still pending after {} ms", bytes.length, sessionId, INPUT_WAIT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof UncheckedIOException io ? io.getCause() : e.getCause();
            throw new ShellSessionException("Failed to write to session " + sessionId + ": " + cause.getMessage(), cause);
        }
        return bytes.length;
    }

    /**
     * Signals the session and waits up to the configured grace period for it to exit.
     * The id is released either way; a process that ignores the signal is still
     * terminated by {@link #cleanupAll()}.
     */
    public StopResult stop(String sessionId, String signalName) {
        ShellSignal signal = ShellSignal.parse(signalName)
                .orElseThrow(() -> new ShellSessionException("Unsupported signal: " + signalName));
        ShellSession session;
        synchronized (lock) {
            session = sessions.get(sessionId);
            if (session == null) {
                throw ShellSessionException.notFound(sessionId);
            }
            if (session.isTerminal()) {
                sessions.remove(sessionId);
                log.info("Released exited shell session {}", sessionId);
                return new StopResult(sessionId, signal, true);
            }
            session.stopRequested = true;
        }

        try {
            signal.deliver(session.process);
        } catch (IOException e) {
            synchronized (lock) {
                session.stopRequested = false;
            }
            throw new ShellSessionException("Failed to send " + signal + " to session " + sessionId + ": " + e.getMessage(), e);
        }
        closeInput(session);

        boolean exited = awaitFinished(session, settings.stopGraceMillis());
        synchronized (lock) {
            sessions.remove(sessionId, session);
            if (!exited) {
                untracked.add(session);
            }
        }
        if (exited) {
            log.info("Stopped shell session {} with {}", sessionId, signal);
        } else {
            log.warn("Shell session {} still running {} ms after {}", sessionId, settings.stopGraceMillis(), signal);
        }
        return new StopResult(sessionId, signal, exited);
    }

    public Optional<SessionSnapshot> describe(String sessionId) {
        synchronized (lock) {
            pruneExited();
            return Optional.ofNullable(sessions.get(sessionId)).map(ShellSession::snapshot);
        }
    }

    public List<SessionSnapshot> listAll() {
        synchronized (lock) {
            pruneExited();
            List<SessionSnapshot> snapshots = new ArrayList<>(sessions.size());
            sessions.values().forEach(s -> snapshots.add(s.snapshot()));
            return snapshots;
        }
    }

    /**
     * Returns and clears the output retained since the previous read. The read that sees
     * an exited session returns its exit code and the rest of its output, and releases the id.
     */
    public SessionOutput readOutput(String sessionId) {
        synchronized (lock) {
            pruneExited();
            ShellSession session = sessions.get(sessionId);
            if (session == null) {
                throw ShellSessionException.notFound(sessionId);
            }
            if (!session.isTerminal()) {
                return new SessionOutput(session.id, session.state, null, session.stdout.drain(),
                        session.stderr.drain(), session.truncated);
            }
            sessions.remove(sessionId);
            log.debug("Released exited shell session {} after final read", sessionId);
            return new SessionOutput(session.id, session.state, session.exitCode, session.stdout.drainAll(),
                    session.stderr.drainAll(), session.truncated);
        }
    }

    /** Sends TERM to everything still alive and forgets all sessions. Runs once. */
    @PreDestroy
    public void cleanupAll() {
        List<ShellSession> victims;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            victims = new ArrayList<>(sessions.values());
            victims.addAll(untracked);
            sessions.clear();
            untracked.clear();
        }

        for (ShellSession session : victims) {
            if (!session.process.isAlive()) {
                continue;
            }
            try {
                ShellSignal.TERM.deliver(session.process);
            } catch (IOException e) {
                log.warn("Failed to terminate session {}: {}", session.id, e.getMessage());
            }
            closeInput(session);
        }

        streamExecutor.shutdown();
        try {
            if (!streamExecutor.awaitTermination(settings.stopGraceMillis(), TimeUnit.MILLISECONDS)) {
                streamExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            streamExecutor.shutdownNow();
        }
        if (!victims.isEmpty()) {
            log.info("Terminated {} shell process(es) on shutdown", victims.size());
        }
    }

    private ShellSession spawn(String id, String command, String cwd, Map<String, String> env,
                               boolean captureStderr, boolean closeStdin) {
        Path directory = cwd == null || cwd.isBlank() ? settings.workingDirectory() : Path.of(cwd);
        if (!Files.isDirectory(directory)) {
            throw new ShellSessionException("Working directory does not exist: " + directory);
        }

        ProcessBuilder pb = new ProcessBuilder(shellCommand(command)).directory(directory.toFile());
        if (env != null) {
            pb.environment().putAll(env);
        }
        if (!captureStderr) {
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ShellSessionException("Failed to start command: " + e.getMessage(), e);
        }

        ShellSession session = new ShellSession(id, command, directory, process);
        if (closeStdin) {
            try {
                session.stdin.close();
            } catch (IOException e) {
                log.debug("Closing stdin of {} failed: {}", id, e.getMessage());
            }
        }

        List<CompletableFuture<Void>> pumps = new ArrayList<>(2);
        pumps.add(CompletableFuture.runAsync(() -> pump(session, process.getInputStream(), true), streamExecutor));
        if (captureStderr) {
            pumps.add(CompletableFuture.runAsync(() -> pump(session, process.getErrorStream(), false), streamExecutor));
        }
        CompletableFuture<Void> drained = CompletableFuture.allOf(pumps.toArray(new CompletableFuture[0]));

        // Grandchildren can keep a pipe open after the process exits; stop waiting for them.
        process.onExit()
                .thenCompose(p -> drained.completeOnTimeout(null, PUMP_DRAIN_MILLIS, TimeUnit.MILLISECONDS))
                .whenComplete((ignored, error) -> commitExit(session, error));
        return session;
    }

    private void pump(ShellSession session, InputStream in, boolean stdout) {
        byte[] chunk = new byte[CHUNK_SIZE];
        try (in) {
            int n;
            while ((n = in.read(chunk)) != -1) {
                synchronized (lock) {
                    session.append(stdout, chunk, n, settings.maxOutputBytes());
                }
            }
        } catch (IOException e) {
            log.debug("{} stream of {} closed: {}", stdout ? "stdout" : "stderr", session.id, e.getMessage());
        }
    }

    private void commitExit(ShellSession session, Throwable error) {
        if (error != null) {
            log.warn("Output of {} not fully drained: {}", session.id, error.getMessage());
        }
        int exitCode = session.process.exitValue();
        synchronized (lock) {
            if (session.exitCode == null) {
                session.exitCode = exitCode;
                session.state = session.stopRequested ? SessionState.STOPPED : SessionState.EXITED;
                session.endedAt = Instant.now();
            }
            if (session.stopRequested) {
                sessions.remove(session.id, session);
            }
            untracked.remove(session);
        }
        log.debug("Process {} ({}) exited with code {}", session.id, session.process.pid(), exitCode);
        session.finished.complete(null);
    }

    private void writeInput(ShellSession session, byte[] bytes) {
        try {
            session.stdin.write(bytes);
            session.stdin.flush();
        } catch (IOException e) {
            log.debug("Writing {} bytes to {} failed: {}", bytes.length, session.id, e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    // A write blocked on a full pipe holds the stream's monitor, so close off the caller's thread.
    private void closeInput(ShellSession session) {
        CompletableFuture.runAsync(() -> {
            try {
                session.stdin.close();
            } catch (IOException e) {
                log.debug("Closing stdin of {} failed: {}", session.id, e.getMessage());
            }
        }, streamExecutor);
    }

    private int liveSessions() {
        int live = 0;
        for (ShellSession session : sessions.values()) {
            if (!session.isTerminal()) {
                live++;
            }
        }
        return live;
    }

    private void pruneExited() {
        Instant cutoff = Instant.now().minus(EXITED_RETENTION);
        sessions.values().removeIf(s -> s.isTerminal() && s.endedAt.isBefore(cutoff));
    }

    private static boolean awaitFinished(ShellSession session, long millis) {
        try {
            session.finished.get(millis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new ShellSessionException("Session " + session.id + " failed: " + e.getCause().getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new ShellSessionException("Shell session manager has been shut down");
        }
    }

    private static List<String> shellCommand(String command) {
        return ShellSignal.isWindows() ? List.of("cmd.exe", "/c", command) : List.of("sh", "-c", command);
    }
}
