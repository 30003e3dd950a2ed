package io.github.drompincen.screencontrol.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.screencontrol.gateway.config.ScreenControlProperties;
import io.github.drompincen.screencontrol.gateway.http.HttpRequestHandler;
import io.github.drompincen.screencontrol.gateway.http.LoopbackHttpServer;
import io.github.drompincen.screencontrol.gateway.mcp.McpOutput;
import io.github.drompincen.screencontrol.gateway.mcp.McpRequestHandler;
import io.github.drompincen.screencontrol.gateway.mcp.McpServerInfo;
import io.github.drompincen.screencontrol.gateway.mcp.StdioMcpBridge;
import io.github.drompincen.screencontrol.runtime.provider.BrowserRelay;
import io.github.drompincen.screencontrol.runtime.tools.ToolAvailability;
import io.github.drompincen.screencontrol.runtime.tools.ToolRegistry;
import io.github.drompincen.screencontrol.runtime.tools.ToolRouter;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/** Starts the loopback HTTP listener and, when requested, the MCP stdio bridge. */
@Component
public class ScreenControlLauncher implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ScreenControlLauncher.class);
    static final String STDIO_ARGUMENT = "--stdio";

    private final ScreenControlProperties properties;
    private final ToolRouter router;
    private final ToolRegistry registry;
    private final ToolAvailability availability;
    private final BrowserRelay browserRelay;
    private final ObjectMapper mapper;
    private final ConfigurableApplicationContext context;

    private LoopbackHttpServer httpServer;
    private StdioMcpBridge bridge;
    private ExecutorService toolExecutor;

    public ScreenControlLauncher(ScreenControlProperties properties, ToolRouter router, ToolRegistry registry,
                                 ToolAvailability availability, BrowserRelay browserRelay, ObjectMapper mapper,
                                 ConfigurableApplicationContext context) {
        this.properties = properties;
        this.router = router;
        this.registry = registry;
        this.availability = availability;
        this.browserRelay = browserRelay;
        this.mapper = mapper;
        this.context = context;
    }

    @Override
    public void run(String... args) {
        if (properties.getHttp().isEnabled()) {
            startHttp();
        }
        if (properties.getMcp().isStdio() || Arrays.asList(args).contains(STDIO_ARGUMENT)) {
            startStdio();
        }
        if (httpServer == null && bridge == null) {
            log.warn("Neither the HTTP listener nor the MCP bridge is enabled");
        }
    }

    private void startHttp() {
        ScreenControlProperties.Http http = properties.getHttp();
        String apiKey = http.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            apiKey = generateApiKey();
            log.info("Generated HTTP API key: {}", apiKey);
        }
        HttpRequestHandler handler = new HttpRequestHandler(router, registry, availability, mapper, apiKey,
                properties.getMcp().getServerVersion());
        httpServer = new LoopbackHttpServer(http.getPort(), http.getMaxRequestBytes(), http.getReceiveTimeoutMs(), handler);
        httpServer.start();
    }

    private void startStdio() {
        AtomicInteger counter = new AtomicInteger();
        toolExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mcp-tool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ScreenControlProperties.Mcp mcp = properties.getMcp();
        McpRequestHandler handler = new McpRequestHandler(router, registry, availability, mapper,
                new McpServerInfo(mcp.getServerName(), mcp.getServerVersion(), mcp.getProtocolVersion()), toolExecutor);
        bridge = new StdioMcpBridge(handler, browserRelay, System.in, new McpOutput(System.out), this::endOfInput);
        bridge.start();
    }

    private void endOfInput() {
        log.info("MCP client disconnected, shutting down");
        context.close();
    }

    public int httpPort() {
        return httpServer == null ? -1 : httpServer.getPort();
    }

    @PreDestroy
    public void shutdown() {
        if (bridge != null) {
            bridge.stop();
        }
        if (toolExecutor != null) {
            toolExecutor.shutdownNow();
        }
        if (httpServer != null) {
            httpServer.stop();
        }
    }

    private static String generateApiKey() {
        byte[] bytes = new byte[24];
        new SecureRandom().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
