package io.github.drompincen.screencontrol.gateway.mcp;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Line writer shared by every producer of MCP frames; one frame is written at a time. */
public class McpOutput {

    private final OutputStream out;

    public McpOutput(OutputStream out) {
        this.out = out;
    }

    public synchronized void writeLine(String json) {
        try {
            out.write((json + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write MCP frame", e);
        }
    }
}
