package io.github.drompincen.screencontrol.gateway.mcp;

/** Identity reported by {@code initialize}. */
public record McpServerInfo(
        String name,
        String version,
        String protocolVersion
) {
}
