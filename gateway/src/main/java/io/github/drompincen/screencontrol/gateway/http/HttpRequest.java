package io.github.drompincen.screencontrol.gateway.http;

import java.util.Locale;
import java.util.Map;

/**
 * One fully read request. Header names are lower-cased; {@code path} has its query
 * string removed.
 */
public record HttpRequest(
        String method,
        String path,
        Map<String, String> headers,
        byte[] body
) {
    public HttpRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
