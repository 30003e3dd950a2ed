package io.github.drompincen.screencontrol.runtime.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Connection to the browser-extension relay. Its connected state decides whether
 * browser tools are advertised.
 */
public interface BrowserRelay {

    boolean isConnected();

    /**
     * Forwards one browser action and waits for the relay's answer.
     *
     * @param browser target browser, or {@code null} for the relay default
     */
    JsonNode forward(String action, JsonNode payload, String browser) throws BrowserRelayException;

    void addConnectionListener(BrowserConnectionListener listener);

    void removeConnectionListener(BrowserConnectionListener listener);
}
