package com.grale.harvester.harvest.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

public class HttpSessionProvider implements SessionProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpSessionProvider.class);

    private final SessionSettings settings;
    private final HttpClient client;

    public HttpSessionProvider(SessionSettings settings) {
        this.settings = settings;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(Math.max(1, settings.connectTimeoutSeconds())))
            .version(HttpClient.Version.HTTP_1_1);
        SSLContext sslContext = SslContexts.forSettings(settings);
        if (sslContext != null) {
            if (!settings.verifyTls()) {
                log.warn("TLS certificate verification is disabled for this session");
            }
            builder.sslContext(sslContext);
        }
        this.client = builder.build();
    }

    public SessionSettings settings() {
        return settings;
    }

    public HttpSessionProvider reconfigure(SessionSettings newSettings) {
        return new HttpSessionProvider(newSettings);
    }

    @Override
    public SessionResponse execute(RequestSpec spec) {
        int maxAttempts = Math.max(1, 1 + settings.maxRetries());
        SessionResponse lastResponse = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResponse = executeOnce(spec);
            if (!shouldRetry(lastResponse) || attempt >= maxAttempts) {
                return lastResponse;
            }
            log.debug("Retrying {} after attempt {} ({})", spec.url(), attempt, describe(lastResponse));
            if (!sleepBackoff(attempt)) {
                return lastResponse;
            }
        }
        return lastResponse;
    }

    private SessionResponse executeOnce(RequestSpec spec) {
        Instant startedAt = Instant.now();
        URI uri = toUri(spec.url());
        if (uri == null || uri.getHost() == null) {
            return SessionResponse.transportError(spec.url(), Duration.ZERO, SessionResponse.INVALID_URL, "URL missing host or malformed");
        }
        try {
            String accept = spec.acceptHeader() == null || spec.acceptHeader().isBlank() ? "*/*" : spec.acceptHeader();
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(Math.max(1, settings.readTimeoutSeconds())))
                .header("User-Agent", settings.userAgent())
                .header("Accept", accept);
            if (settings.headers() != null) {
                for (Map.Entry<String, String> header : settings.headers().entrySet()) {
                    builder.header(header.getKey(), header.getValue());
                }
            }
            HttpResponse<byte[]> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofByteArray());
            return new SessionResponse(
                spec.url(),
                response.statusCode(),
                response.body(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return SessionResponse.transportError(spec.url(), Duration.between(startedAt, Instant.now()), SessionResponse.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return SessionResponse.transportError(spec.url(), Duration.between(startedAt, Instant.now()), SessionResponse.IO_ERROR, describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SessionResponse.transportError(spec.url(), Duration.between(startedAt, Instant.now()), SessionResponse.INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return SessionResponse.transportError(spec.url(), Duration.between(startedAt, Instant.now()), SessionResponse.HTTP_ERROR, describe(e));
        }
    }

    private boolean shouldRetry(SessionResponse response) {
        if (response == null) {
            return false;
        }
        String errorCode = response.errorCode();
        if (errorCode != null) {
            return !errorCode.equals(SessionResponse.INVALID_URL) && !errorCode.equals(SessionResponse.INTERRUPTED);
        }
        return settings.shouldRetryStatus(response.statusCode());
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = settings.retryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = settings.retryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String describe(SessionResponse response) {
        return response.errorCode() != null ? response.errorCode() : "http_" + response.statusCode();
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
