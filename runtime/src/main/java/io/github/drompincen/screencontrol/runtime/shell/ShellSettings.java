package io.github.drompincen.screencontrol.runtime.shell;

import java.nio.file.Path;

public record ShellSettings(
        int defaultTimeoutSeconds,
        int maxOutputBytes,
        int maxSessions,
        long stopGraceMillis,
        Path workingDirectory
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 600;
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 128 * 1024;
    public static final int DEFAULT_MAX_SESSIONS = 10;
    public static final long DEFAULT_STOP_GRACE_MILLIS = 2000;

    public ShellSettings {
        if (defaultTimeoutSeconds <= 0) defaultTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        if (maxOutputBytes <= 0) maxOutputBytes = DEFAULT_MAX_OUTPUT_BYTES;
        if (maxSessions <= 0) maxSessions = DEFAULT_MAX_SESSIONS;
        if (stopGraceMillis < 0) stopGraceMillis = DEFAULT_STOP_GRACE_MILLIS;
        if (workingDirectory == null) workingDirectory = Path.of(System.getProperty("user.dir"));
    }

    public static ShellSettings defaults() {
        return new ShellSettings(DEFAULT_TIMEOUT_SECONDS, DEFAULT_MAX_OUTPUT_BYTES, DEFAULT_MAX_SESSIONS,
                DEFAULT_STOP_GRACE_MILLIS, null);
    }
}
