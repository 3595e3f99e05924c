package com.grale.harvester.harvest.esri;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.EsriFixtures;
import com.grale.harvester.harvest.http.HttpSessionProvider;
import com.grale.harvester.harvest.http.SessionSettings;
import com.grale.harvester.harvest.model.ProbeResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureServiceProbeTest {
    private MockWebServer server;
    private FeatureServiceProbe probe;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        SessionSettings settings = SessionSettings.defaults().withTimeouts(1, 1).withRetries(0, 0, 0);
        probe = new FeatureServiceProbe(new HttpSessionProvider(settings), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void readsMetadataAndCount() throws Exception {
        server.enqueue(new MockResponse().setBody(EsriFixtures.fixture("layer-metadata.json")));
        server.enqueue(new MockResponse().setBody(EsriFixtures.count(3050)));
        String layerUrl = server.url("/arcgis/rest/services/Parks/FeatureServer/0").toString();

        ProbeResult result = probe.probe(layerUrl, "STATE='CO'");

        assertThat(result.totalCount()).isEqualTo(3050);
        assertThat(result.maxPageSize()).isEqualTo(1000);
        assertThat(result.metadata().name()).isEqualTo("Parks");
        assertThat(result.metadata().layerId()).isEqualTo("0");
        assertThat(result.metadata().wkid()).isEqualTo("3857");
        assertThat(result.metadata().supportedQueryFormats()).containsExactly("JSON", "geoJSON", "PBF");
        assertThat(result.metadata().supportsFormat("geojson")).isTrue();

        RecordedRequest metadataRequest = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(metadataRequest.getRequestUrl().queryParameter("f")).isEqualTo("json");
        RecordedRequest countRequest = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(countRequest.getRequestUrl().encodedPath()).endsWith("/FeatureServer/0/query");
        assertThat(countRequest.getRequestUrl().queryParameter("where")).isEqualTo("STATE='CO'");
        assertThat(countRequest.getRequestUrl().queryParameter("returnCountOnly")).isEqualTo("true");
    }

    @Test
    void serviceErrorEnvelopeFailsProbe() {
        server.enqueue(new MockResponse().setBody(EsriFixtures.serviceError(499, "Token Required")));
        String layerUrl = server.url("/arcgis/rest/services/Secure/FeatureServer/0").toString();

        assertThatThrownBy(() -> probe.probe(layerUrl, null))
            .isInstanceOf(ProbeException.class)
            .hasMessageContaining("499");
    }

    @Test
    void timeoutFailsProbe() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        String layerUrl = server.url("/arcgis/rest/services/Slow/FeatureServer/0").toString();

        assertThatThrownBy(() -> probe.probe(layerUrl, null))
            .isInstanceOf(ProbeException.class)
            .hasMessageContaining("timeout");
    }

    @Test
    void missingCountFailsProbe() {
        server.enqueue(new MockResponse().setBody(EsriFixtures.fixture("layer-metadata.json")));
        server.enqueue(new MockResponse().setBody("{\"objectIds\":[]}"));
        String layerUrl = server.url("/arcgis/rest/services/Parks/FeatureServer/0").toString();

        assertThatThrownBy(() -> probe.probe(layerUrl, null)).isInstanceOf(ProbeException.class);
    }
}
