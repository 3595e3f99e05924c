package com.grale.harvester.harvest.http;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

public record SessionResponse(
    String requestedUrl,
    int statusCode,
    byte[] body,
    Duration elapsed,
    String errorCode,
    String errorMessage
) {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";
    public static final String HTTP_ERROR = "http_error";

    public static SessionResponse transportError(String url, Duration elapsed, String errorCode, String errorMessage) {
        return new SessionResponse(url, 0, null, elapsed, errorCode, errorMessage);
    }

    public boolean isTransportError() {
        return errorCode != null;
    }

    public boolean isHttpSuccess() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    public int size() {
        return body == null ? 0 : body.length;
    }

    public String bodyText() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    public Duration elapsedOrZero() {
        return elapsed == null ? Duration.ZERO : elapsed;
    }
}
