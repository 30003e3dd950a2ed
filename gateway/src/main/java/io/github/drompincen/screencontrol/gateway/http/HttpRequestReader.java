package io.github.drompincen.screencontrol.gateway.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads one request from a socket: headers up to the blank line, then {@code Content-Length}
 * bytes of body. A read that stalls longer than the receive timeout ends the request with
 * whatever has arrived.
 */
class HttpRequestReader {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestReader.class);
    private static final byte[] CRLF_CRLF = {'\r', '\n', '\r', '\n'};
    private static final byte[] LF_LF = {'\n', '\n'};

    private enum State { AWAITING_HEADERS, AWAITING_BODY, COMPLETE }

    private final int maxRequestBytes;
    private final int receiveTimeoutMillis;

    HttpRequestReader(int maxRequestBytes, int receiveTimeoutMillis) {
        this.maxRequestBytes = maxRequestBytes;
        this.receiveTimeoutMillis = receiveTimeoutMillis;
    }

    /**
     * @return the request, or {@code null} when the peer sent nothing
     * @throws RequestTooLargeException when the request would exceed the size ceiling
     * @throws MalformedRequestException when the request line cannot be parsed
     */
    HttpRequest read(Socket socket) throws IOException {
        socket.setSoTimeout(receiveTimeoutMillis);
        InputStream in = socket.getInputStream();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];

        State state = State.AWAITING_HEADERS;
        int headerEnd = -1;
        int bodyStart = -1;
        int contentLength = 0;
        Map<String, String> headers = Map.of();
        String requestLine = null;

        while (state != State.COMPLETE) {
            int n;
            try {
                n = in.read(chunk);
            } catch (SocketTimeoutException e) {
                log.debug("Receive timeout after {} bytes, treating request as complete", buffer.size());
                break;
            }
            if (n < 0) {
                break;
            }
            buffer.write(chunk, 0, n);
            if (buffer.size() > maxRequestBytes) {
                throw new RequestTooLargeException(maxRequestBytes);
            }

            if (state == State.AWAITING_HEADERS) {
                byte[] data = buffer.toByteArray();
                headerEnd = indexOf(data, CRLF_CRLF);
                bodyStart = headerEnd < 0 ? -1 : headerEnd + CRLF_CRLF.length;
                if (headerEnd < 0) {
                    headerEnd = indexOf(data, LF_LF);
                    bodyStart = headerEnd < 0 ? -1 : headerEnd + LF_LF.length;
                }
                if (headerEnd < 0) {
                    continue;
                }
                String head = new String(data, 0, headerEnd, StandardCharsets.ISO_8859_1);
                int firstLineEnd = head.indexOf('\n');
                requestLine = (firstLineEnd < 0 ? head : head.substring(0, firstLineEnd)).trim();
                headers = parseHeaders(firstLineEnd < 0 ? "" : head.substring(firstLineEnd + 1));
                contentLength = contentLength(headers.get("content-length"));
                if ((long) bodyStart + contentLength > maxRequestBytes) {
                    throw new RequestTooLargeException(maxRequestBytes);
                }
                state = contentLength > 0 ? State.AWAITING_BODY : State.COMPLETE;
            }
            if (state == State.AWAITING_BODY && buffer.size() - bodyStart >= contentLength) {
                state = State.COMPLETE;
            }
        }

        byte[] data = buffer.toByteArray();
        if (data.length == 0) {
            return null;
        }
        if (requestLine == null) {
            // Headers never terminated; take what arrived as the header block.
            String head = new String(data, StandardCharsets.ISO_8859_1);
            int firstLineEnd = head.indexOf('\n');
            requestLine = (firstLineEnd < 0 ? head : head.substring(0, firstLineEnd)).trim();
            headers = parseHeaders(firstLineEnd < 0 ? "" : head.substring(firstLineEnd + 1));
            bodyStart = data.length;
        }

        String[] parts = requestLine.split(" ");
        if (parts.length < 2 || parts[0].isEmpty()) {
            throw new MalformedRequestException("Malformed request line: " + requestLine);
        }
        int bodyEnd = Math.min(data.length, bodyStart + contentLength);
        byte[] body = Arrays.copyOfRange(data, Math.min(bodyStart, data.length), bodyEnd);
        return new HttpRequest(parts[0].toUpperCase(Locale.ROOT), stripQuery(parts[1]), headers, body);
    }

    static int contentLength(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Map<String, String> parseHeaders(String block) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String line : block.split("\n")) {
            int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim().toLowerCase(Locale.ROOT), line.substring(colon + 1).trim());
            }
        }
        return headers;
    }

    private static String stripQuery(String target) {
        int q = target.indexOf('?');
        return q < 0 ? target : target.substring(0, q);
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    static class MalformedRequestException extends IOException {
        MalformedRequestException(String message) {
            super(message);
        }
    }
}
