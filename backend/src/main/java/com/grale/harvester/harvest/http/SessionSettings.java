package com.grale.harvester.harvest.http;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

public record SessionSettings(
    String userAgent,
    int connectTimeoutSeconds,
    int readTimeoutSeconds,
    int maxRetries,
    int retryBaseDelayMs,
    int retryMaxDelayMs,
    Set<Integer> retryStatusCodes,
    boolean verifyTls,
    Path pkcs12Path,
    char[] pkcs12Password,
    Map<String, String> headers
) {
    public static final Set<Integer> DEFAULT_RETRY_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);

    public static SessionSettings defaults() {
        return new SessionSettings(
            "grale-harvester/0.1",
            30,
            180,
            5,
            0,
            10_000,
            DEFAULT_RETRY_STATUS_CODES,
            true,
            null,
            null,
            Map.of()
        );
    }

    public SessionSettings withRetries(int retries, int baseDelayMs, int maxDelayMs) {
        return new SessionSettings(userAgent, connectTimeoutSeconds, readTimeoutSeconds, retries, baseDelayMs,
            maxDelayMs, retryStatusCodes, verifyTls, pkcs12Path, pkcs12Password, headers);
    }

    public SessionSettings withTimeouts(int connectSeconds, int readSeconds) {
        return new SessionSettings(userAgent, connectSeconds, readSeconds, maxRetries, retryBaseDelayMs,
            retryMaxDelayMs, retryStatusCodes, verifyTls, pkcs12Path, pkcs12Password, headers);
    }

    public SessionSettings withClientCertificate(Path path, char[] password) {
        return new SessionSettings(userAgent, connectTimeoutSeconds, readTimeoutSeconds, maxRetries, retryBaseDelayMs,
            retryMaxDelayMs, retryStatusCodes, verifyTls, path, password, headers);
    }

    public boolean hasClientCertificate() {
        return pkcs12Path != null && pkcs12Password != null;
    }

    public boolean shouldRetryStatus(int status) {
        return retryStatusCodes != null && retryStatusCodes.contains(status);
    }
}
