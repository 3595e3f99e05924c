package com.grale.harvester.harvest.http;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HttpSessionProviderTest {
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void retriesConfiguredStatusCodesUntilSuccess() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"features\":[]}"));

        HttpSessionProvider provider = new HttpSessionProvider(SessionSettings.defaults().withRetries(2, 0, 0));
        SessionResponse response = provider.execute(RequestSpec.json(server.url("/query").toString()));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.bodyText()).isEqualTo("{\"features\":[]}");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("bad"));

        HttpSessionProvider provider = new HttpSessionProvider(SessionSettings.defaults().withRetries(3, 0, 0));
        SessionResponse response = provider.execute(RequestSpec.json(server.url("/query").toString()));

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void givesUpAfterRetryBudget() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(502).setBody("gateway"));
        }

        HttpSessionProvider provider = new HttpSessionProvider(SessionSettings.defaults().withRetries(2, 1, 5));
        SessionResponse response = provider.execute(RequestSpec.json(server.url("/query").toString()));

        assertThat(response.statusCode()).isEqualTo(502);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void slowResponseBecomesTimeout() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        SessionSettings settings = SessionSettings.defaults().withTimeouts(1, 1).withRetries(0, 0, 0);
        SessionResponse response = new HttpSessionProvider(settings).execute(RequestSpec.json(server.url("/slow").toString()));

        assertThat(response.isTransportError()).isTrue();
        assertThat(response.errorCode()).isEqualTo(SessionResponse.TIMEOUT);
        assertThat(response.elapsed()).isNotNull();
    }

    @Test
    void malformedUrlIsNotRetried() {
        HttpSessionProvider provider = new HttpSessionProvider(SessionSettings.defaults().withRetries(5, 0, 0));
        SessionResponse response = provider.execute(RequestSpec.json("not a url"));

        assertThat(response.errorCode()).isEqualTo(SessionResponse.INVALID_URL);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void sendsUserAgentAndAcceptHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        new HttpSessionProvider(SessionSettings.defaults()).execute(RequestSpec.json(server.url("/meta").toString()));

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getHeader("User-Agent")).isEqualTo("grale-harvester/0.1");
        assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void reconfigureReturnsNewProviderAndLeavesOriginalUntouched() {
        HttpSessionProvider original = new HttpSessionProvider(SessionSettings.defaults());
        HttpSessionProvider changed = original.reconfigure(SessionSettings.defaults().withTimeouts(5, 10));

        assertThat(changed).isNotSameAs(original);
        assertThat(changed.settings().readTimeoutSeconds()).isEqualTo(10);
        assertThat(original.settings().readTimeoutSeconds()).isEqualTo(180);
    }
}
