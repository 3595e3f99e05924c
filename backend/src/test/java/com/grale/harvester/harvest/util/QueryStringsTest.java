package com.grale.harvester.harvest.util;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringsTest {

    @Test
    void encodesParametersAndParsesThemBack() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("where", "STATE = 'CO'");
        params.put("outFields", "NAME, CITY");
        params.put("resultOffset", "2000");
        params.put("skipped", null);

        String url = QueryStrings.prepare("https://example.com/arcgis/rest/services/Parks/FeatureServer/0/query", params);

        assertThat(url).startsWith("https://example.com/arcgis/rest/services/Parks/FeatureServer/0/query?where=");
        assertThat(url).doesNotContain(" ").doesNotContain("skipped");

        Map<String, List<String>> parsed = QueryStrings.parse(url);
        assertThat(parsed.get("where")).containsExactly("STATE = 'CO'");
        assertThat(parsed.get("outFields")).containsExactly("NAME, CITY");
        assertThat(parsed.get("resultOffset")).containsExactly("2000");
        assertThat(parsed.get(QueryStrings.BASE_URL))
            .containsExactly("https://example.com/arcgis/rest/services/Parks/FeatureServer/0/query");
    }

    @Test
    void equalsSignInValueIsEscaped() {
        String url = QueryStrings.prepare("http://localhost/query", Map.of("where", "1=1"));
        assertThat(url).isEqualTo("http://localhost/query?where=1%3D1");
        assertThat(QueryStrings.parse(url).get("where")).containsExactly("1=1");
    }

    @Test
    void plusSignInWhereClauseSurvivesTheRoundTrip() {
        String url = QueryStrings.prepare("http://localhost/query", Map.of("where", "POP2010 + POP2000 > 5"));

        assertThat(url).contains("%2B").doesNotContain(" ");
        assertThat(QueryStrings.parse(url).get("where")).containsExactly("POP2010 + POP2000 > 5");
    }

    @Test
    void jsonValuesAndReservedCharactersProduceAValidUri() throws Exception {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("geometry", "{\"xmin\":-105,\"ymin\":39,\"xmax\":-104,\"ymax\":40}");
        params.put("where", "NAME = 'A&B' AND CODE = 'x=y'");
        params.put("f", "json");

        String url = QueryStrings.prepare("https://example.com/arcgis/rest/services/Parks/FeatureServer/0/query", params);

        URI uri = new URI(url);
        assertThat(uri.getHost()).isEqualTo("example.com");
        assertThat(uri.getRawQuery()).doesNotContain("{").doesNotContain("\"");
        Map<String, List<String>> parsed = QueryStrings.parse(url);
        assertThat(parsed.get("geometry")).containsExactly("{\"xmin\":-105,\"ymin\":39,\"xmax\":-104,\"ymax\":40}");
        assertThat(parsed.get("where")).containsExactly("NAME = 'A&B' AND CODE = 'x=y'");
        assertThat(parsed.get("f")).containsExactly("json");
    }
}
