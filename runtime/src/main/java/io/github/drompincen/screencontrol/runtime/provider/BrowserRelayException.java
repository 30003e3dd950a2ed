package io.github.drompincen.screencontrol.runtime.provider;

public class BrowserRelayException extends Exception {

    public BrowserRelayException(String message) {
        super(message);
    }

    public BrowserRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
