package io.github.drompincen.screencontrol.runtime.shell;

public class ShellSessionException extends RuntimeException {

    public ShellSessionException(String message) {
        super(message);
    }

    public ShellSessionException(String message, Throwable cause) {
        super(message, cause);
    }

    static ShellSessionException notFound(String sessionId) {
        return new ShellSessionException("Session " + sessionId + " not found");
    }

    static ShellSessionException notRunning(String sessionId) {
        return new ShellSessionException("Session " + sessionId + " is not running");
    }
}
