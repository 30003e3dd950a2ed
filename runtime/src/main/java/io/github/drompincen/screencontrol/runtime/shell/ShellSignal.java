package io.github.drompincen.screencontrol.runtime.shell;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Signals accepted by {@code shell_stop_session}. TERM and KILL map onto
 * {@link Process#destroy()} and {@link Process#destroyForcibly()}; the rest go through
 * {@code kill(1)} and degrade to a plain destroy where there is no such command.
 */
public enum ShellSignal {
    TERM, KILL, INT, HUP, QUIT, USR1, USR2;

    /** Accepts {@code TERM}, {@code SIGTERM} or {@code term}; a blank value means TERM. */
    public static Optional<ShellSignal> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(TERM);
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        if (name.startsWith("SIG")) {
            name = name.substring(3);
        }
        for (ShellSignal signal : values()) {
            if (signal.name().equals(name)) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }

    void deliver(Process process) throws IOException {
        switch (this) {
            case TERM -> {
                process.descendants().forEach(ProcessHandle::destroy);
                process.destroy();
            }
            case KILL -> destroyTree(process);
            default -> {
                if (isWindows()) {
                    process.destroy();
                } else {
                    sendWithKill(process.pid());
                }
            }
        }
    }

    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private void sendWithKill(long pid) throws IOException {
        Process kill = new ProcessBuilder("kill", "-s", name(), Long.toString(pid))
                .redirectErrorStream(true)
                .start();
        try {
            if (!kill.waitFor(5, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                throw new IOException("kill -s " + name() + " timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending " + name(), e);
        }
        if (kill.exitValue() != 0) {
            String detail = new String(kill.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            throw new IOException("kill -s " + name() + " failed: " + detail);
        }
    }

    static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
