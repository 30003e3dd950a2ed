package io.github.drompincen.screencontrol.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.screencontrol.runtime.provider.BrowserConnectionListener;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelay;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Talks to the browser bridge over loopback HTTP: {@code GET /browsers} for the
 * connection state and {@code POST /command} for actions.
 */
public class HttpBrowserRelay implements BrowserRelay {

    private static final Logger log = LoggerFactory.getLogger(HttpBrowserRelay.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final int MIN_TIMEOUT_SECONDS = 30;
    static final int MAX_TIMEOUT_SECONDS = 120;

    private final URI bridgeUrl;
    private final int timeoutSeconds;
    private final HttpClient client;
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final List<BrowserConnectionListener> listeners = new CopyOnWriteArrayList<>();

    public HttpBrowserRelay(URI bridgeUrl, int timeoutSeconds) {
        this.bridgeUrl = bridgeUrl;
        this.timeoutSeconds = Math.max(MIN_TIMEOUT_SECONDS, Math.min(MAX_TIMEOUT_SECONDS, timeoutSeconds));
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public JsonNode forward(String action, JsonNode payload, String browser) throws BrowserRelayException {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("action", action);
        body.set("payload", payload == null ? MAPPER.createObjectNode() : payload);
        if (browser != null) {
            body.put("browser", browser);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(bridgeUrl.resolve("/command"))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                    .build();
        } catch (IOException e) {
            throw new BrowserRelayException("Failed to serialize request: " + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new BrowserRelayException("Browser command timed out after " + timeoutSeconds + " seconds", e);
        } catch (IOException e) {
            markDisconnected();
            throw new BrowserRelayException("Browser bridge error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserRelayException("Interrupted while waiting for the browser bridge", e);
        }

        if (response.statusCode() != 200) {
            throw new BrowserRelayException("HTTP " + response.statusCode());
        }
        JsonNode result;
        try {
            result = response.body() == null || response.body().isBlank()
                    ? MAPPER.createObjectNode().put("success", true)
                    : MAPPER.readTree(response.body());
        } catch (IOException e) {
            throw new BrowserRelayException("Failed to parse response: " + e.getMessage(), e);
        }
        if (result.hasNonNull("error")) {
            JsonNode error = result.get("error");
            throw new BrowserRelayException(error.isTextual() ? error.asText() : error.toString());
        }
        return result;
    }

    /** Polls {@code GET /browsers}; connected while at least one browser is listed. */
    public boolean refreshConnectionState() {
        boolean now;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(bridgeUrl.resolve("/browsers"))
                    .timeout(Duration.ofSeconds(2))
                    .GET()
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            now = response.statusCode() == 200 && hasBrowsers(MAPPER.readTree(response.body()));
        } catch (IOException e) {
            log.trace("Browser bridge not reachable at {}: {}", bridgeUrl, e.getMessage());
            now = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return connected.get();
        }
        updateConnected(now);
        return now;
    }

    private static boolean hasBrowsers(JsonNode body) {
        JsonNode browsers = body == null ? null : body.get("browsers");
        return browsers != null && browsers.isArray() && browsers.size() > 0;
    }

    private void markDisconnected() {
        updateConnected(false);
    }

    void updateConnected(boolean now) {
        if (connected.getAndSet(now) != now) {
            log.info("Browser relay {}", now ? "connected" : "disconnected");
            for (BrowserConnectionListener listener : listeners) {
                try {
                    listener.connectionChanged(now);
                } catch (RuntimeException e) {
                    log.error("Browser connection listener failed", e);
                }
            }
        }
    }

    @Override
    public void addConnectionListener(BrowserConnectionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeConnectionListener(BrowserConnectionListener listener) {
        listeners.remove(listener);
    }
}
