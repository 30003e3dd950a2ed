package io.github.drompincen.screencontrol.gateway.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal HTTP/1.1 listener bound to the loopback interface. One request per connection;
 * each connection is served on its own worker thread.
 */
public class LoopbackHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoopbackHttpServer.class);
    private static final long MAX_DISCARD_BYTES = 4L * 1024 * 1024;

    private final int requestedPort;
    private final HttpRequestReader reader;
    private final HttpRequestHandler handler;
    private final ExecutorService workers;
    private volatile ServerSocket serverSocket;
    private volatile boolean running;

    public LoopbackHttpServer(int port, int maxRequestBytes, int receiveTimeoutMillis, HttpRequestHandler handler) {
        this.requestedPort = port;
        this.reader = new HttpRequestReader(maxRequestBytes, receiveTimeoutMillis);
        this.handler = handler;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-conn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Binds and starts accepting. A bind failure is fatal. */
    public void start() {
        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), requestedPort));
            serverSocket = socket;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind HTTP listener on port " + requestedPort, e);
        }
        running = true;
        // Non-daemon: keeps the process alive while the listener is open.
        new Thread(this::acceptLoop, "http-acceptor").start();
        log.info("HTTP listener bound to {}:{}", serverSocket.getInetAddress().getHostAddress(), getPort());
    }

    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    private void acceptLoop() {
        while (running) {
            Socket connection;
            try {
                connection = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    log.warn("Accept failed: {}", e.getMessage());
                }
                continue;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            workers.execute(() -> serve(connection));
        }
    }

    private void serve(Socket connection) {
        try (Socket socket = connection) {
            HttpResponse response;
            boolean rejected = false;
            try {
                HttpRequest request = reader.read(socket);
                if (request == null) {
                    return;
                }
                response = handler.handle(request);
            } catch (RequestTooLargeException e) {
                log.warn("Rejected request: {}", e.getMessage());
                response = HttpResponse.json(413, "{\"error\":\"Request too large\"}");
                rejected = true;
            } catch (HttpRequestReader.MalformedRequestException e) {
                log.debug("{}", e.getMessage());
                response = HttpResponse.json(400, "{\"error\":\"Bad request\"}");
            } catch (RuntimeException e) {
                log.error("Unhandled error serving request", e);
                response = HttpResponse.json(500, "{\"error\":\"Internal server error\"}");
            }
            response.writeTo(socket.getOutputStream());
            socket.shutdownOutput();
            if (rejected) {
                discardUnread(socket);
            }
        } catch (IOException e) {
            log.warn("Connection error: {}", e.getMessage());
        }
    }

    // Unread input at close time turns into a reset that can destroy the response in flight.
    private static void discardUnread(Socket socket) {
        try {
            socket.setSoTimeout(200);
            byte[] sink = new byte[8192];
            long discarded = 0;
            int n;
            while (discarded < MAX_DISCARD_BYTES && (n = socket.getInputStream().read(sink)) >= 0) {
                discarded += n;
            }
        } catch (IOException e) {
            log.debug("Stopped discarding rejected request body: {}", e.getMessage());
        }
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Failed to close HTTP listener: {}", e.getMessage());
        }
        workers.shutdownNow();
        try {
            workers.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("HTTP listener stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
