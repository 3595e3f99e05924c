package com.grale.harvester.harvest.esri;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.http.RequestSpec;
import com.grale.harvester.harvest.http.SessionProvider;
import com.grale.harvester.harvest.http.SessionResponse;
import com.grale.harvester.harvest.model.ProbeResult;
import com.grale.harvester.harvest.model.QueryParameters;
import com.grale.harvester.harvest.model.ServiceMetadata;
import com.grale.harvester.harvest.util.QueryStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One-shot probe of a feature layer: its metadata document and the number of
 * records matching a where clause. Probe calls are not lineage-logged; any
 * failure here aborts the harvest before a chunk is planned.
 */
@Component
public class FeatureServiceProbe {
    private static final Logger log = LoggerFactory.getLogger(FeatureServiceProbe.class);

    private final SessionProvider sessionProvider;
    private final ObjectMapper objectMapper;

    public FeatureServiceProbe(SessionProvider sessionProvider, ObjectMapper objectMapper) {
        this.sessionProvider = sessionProvider;
        this.objectMapper = objectMapper;
    }

    public ProbeResult probe(String layerUrl, String where) {
        return probe(sessionProvider, layerUrl, where);
    }

    public ProbeResult probe(SessionProvider session, String layerUrl, String where) {
        ServiceMetadata metadata = fetchMetadata(session, layerUrl);
        long count = fetchCount(session, layerUrl, where);
        log.debug("Probed {}: count={} maxRecordCount={}", layerUrl, count, metadata.maxRecordCount());
        return new ProbeResult(count, metadata.maxRecordCount(), metadata);
    }

    public ServiceMetadata fetchMetadata(SessionProvider session, String layerUrl) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("f", QueryParameters.FORMAT_JSON);
        JsonNode document = fetch(session, QueryStrings.prepare(layerUrl, params), "metadata");
        Integer maxRecordCount = document.hasNonNull("maxRecordCount") && document.get("maxRecordCount").canConvertToInt()
            ? document.get("maxRecordCount").asInt()
            : null;
        return new ServiceMetadata(
            textOrNull(document, "name"),
            textOrNull(document, "id"),
            maxRecordCount,
            ServiceMetadata.splitFormats(textOrNull(document, "supportedQueryFormats")),
            wkid(document),
            document
        );
    }

    public long fetchCount(SessionProvider session, String layerUrl, String where) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("where", where == null || where.isBlank() ? QueryParameters.DEFAULT_WHERE : where);
        params.put("returnCountOnly", "true");
        params.put("f", QueryParameters.FORMAT_JSON);
        JsonNode document = fetch(session, QueryStrings.prepare(layerUrl + "/query", params), "record count");
        JsonNode count = document.get("count");
        if (count == null || !count.canConvertToLong() || count.asLong() < 0) {
            throw new ProbeException("Service did not report a record count for " + layerUrl);
        }
        return count.asLong();
    }

    private JsonNode fetch(SessionProvider session, String url, String what) {
        SessionResponse response = session.execute(RequestSpec.json(url));
        if (response.isTransportError()) {
            throw new ProbeException("Probe for " + what + " failed (" + response.errorCode() + "): " + response.errorMessage());
        }
        JsonNode document;
        try {
            document = objectMapper.readTree(response.body() == null ? new byte[0] : response.body());
        } catch (IOException e) {
            throw new ProbeException("Probe for " + what + " returned an unreadable body from " + url, e);
        }
        if (document == null || !document.isObject()) {
            throw new ProbeException("Probe for " + what + " returned an unreadable body from " + url);
        }
        JsonNode error = document.get("error");
        if (error != null && !error.isNull()) {
            String code = error.path("code").asText("Unidentified");
            throw new ProbeException("Service rejected " + what + " probe with error " + code + ": " + error.path("message").asText(""));
        }
        if (!response.isHttpSuccess()) {
            throw new ProbeException("Probe for " + what + " returned HTTP " + response.statusCode());
        }
        return document;
    }

    private String wkid(JsonNode document) {
        for (String container : new String[]{"extent", "sourceSpatialReference"}) {
            JsonNode reference = "extent".equals(container)
                ? document.path("extent").path("spatialReference")
                : document.path(container);
            if (reference.hasNonNull("latestWkid")) {
                return reference.get("latestWkid").asText();
            }
            if (reference.hasNonNull("wkid")) {
                return reference.get("wkid").asText();
            }
        }
        return null;
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
