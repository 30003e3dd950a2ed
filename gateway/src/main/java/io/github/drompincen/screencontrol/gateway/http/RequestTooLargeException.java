package io.github.drompincen.screencontrol.gateway.http;

import java.io.IOException;

public class RequestTooLargeException extends IOException {

    public RequestTooLargeException(int limit) {
        super("Request exceeds " + limit + " bytes");
    }
}
