package io.github.drompincen.screencontrol.gateway.mcp;

import io.github.drompincen.screencontrol.runtime.provider.BrowserConnectionListener;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Newline-delimited JSON-RPC over a pair of streams. A dedicated thread reads input lines;
 * responses and {@code tools/list_changed} notifications go through one {@link McpOutput}.
 */
public class StdioMcpBridge {

    private static final Logger log = LoggerFactory.getLogger(StdioMcpBridge.class);

    private final McpRequestHandler handler;
    private final BrowserRelay browserRelay;
    private final InputStream in;
    private final McpOutput output;
    private final Runnable onEndOfInput;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final BrowserConnectionListener availabilityListener = this::browserConnectionChanged;
    private volatile boolean running;

    public StdioMcpBridge(McpRequestHandler handler, BrowserRelay browserRelay,
                          InputStream in, McpOutput output, Runnable onEndOfInput) {
        this.handler = handler;
        this.browserRelay = browserRelay;
        this.in = in;
        this.output = output;
        this.onEndOfInput = onEndOfInput;
    }

    public void start() {
        running = true;
        browserRelay.addConnectionListener(availabilityListener);
        new Thread(this::readLoop, "mcp-stdin").start();
        log.info("MCP stdio bridge started");
    }

    public void stop() {
        running = false;
        browserRelay.removeConnectionListener(availabilityListener);
    }

    /** Waits for the input stream to end. */
    public boolean awaitEndOfInput(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                dispatch(line);
            }
        } catch (IOException e) {
            log.error("Failed to read MCP input", e);
        } finally {
            log.info("MCP input closed");
            stop();
            finished.countDown();
            onEndOfInput.run();
        }
    }

    private void dispatch(String line) {
        handler.handle(line).whenComplete((response, error) -> {
            if (error != null) {
                log.error("MCP request failed: {}", line, error);
                return;
            }
            response.ifPresent(this::write);
        });
    }

    private void browserConnectionChanged(boolean connected) {
        if (running) {
            log.debug("Tool availability changed (browser {}), notifying client", connected ? "connected" : "disconnected");
            write(handler.toolsListChanged());
        }
    }

    private void write(String frame) {
        try {
            output.writeLine(frame);
        } catch (UncheckedIOException e) {
            log.warn("Failed to write MCP frame: {}", e.getMessage());
        }
    }
}
