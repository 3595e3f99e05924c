package com.grale.harvester.harvest.esri;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EsriGeoJsonConverterTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EsriGeoJsonConverter converter = new EsriGeoJsonConverter(objectMapper);

    @Test
    void convertsPointFeatureWithAttributesAndId() throws Exception {
        JsonNode featureSet = objectMapper.readTree("""
            {"objectIdFieldName":"FID","features":[
              {"attributes":{"FID":7,"NAME":"Central"},"geometry":{"x":-104.9,"y":39.7}}
            ]}
            """);

        ObjectNode collection = converter.toFeatureCollection(featureSet);

        assertThat(collection.get("type").asText()).isEqualTo("FeatureCollection");
        JsonNode feature = collection.get("features").get(0);
        assertThat(feature.get("type").asText()).isEqualTo("Feature");
        assertThat(feature.get("id").asInt()).isEqualTo(7);
        assertThat(feature.get("properties").get("NAME").asText()).isEqualTo("Central");
        assertThat(feature.get("geometry").get("type").asText()).isEqualTo("Point");
        assertThat(feature.get("geometry").get("coordinates").get(0).asDouble()).isEqualTo(-104.9);
    }

    @Test
    void convertsPathsToLineStrings() throws Exception {
        JsonNode single = objectMapper.readTree("{\"paths\":[[[0,0],[1,1]]]}");
        JsonNode multi = objectMapper.readTree("{\"paths\":[[[0,0],[1,1]],[[2,2],[3,3]]]}");

        assertThat(converter.toGeometry(single).get("type").asText()).isEqualTo("LineString");
        assertThat(converter.toGeometry(multi).get("type").asText()).isEqualTo("MultiLineString");
        assertThat(converter.toGeometry(objectMapper.readTree("{\"points\":[[0,0],[1,1]]}")).get("type").asText())
            .isEqualTo("MultiPoint");
    }

    @Test
    void clockwiseRingWithCounterClockwiseHoleBecomesPolygonWithHole() throws Exception {
        JsonNode geometry = objectMapper.readTree("""
            {"rings":[
              [[0,0],[0,10],[10,10],[10,0],[0,0]],
              [[2,2],[4,2],[4,4],[2,4],[2,2]]
            ]}
            """);

        JsonNode polygon = converter.toGeometry(geometry);

        assertThat(polygon.get("type").asText()).isEqualTo("Polygon");
        assertThat(polygon.get("coordinates")).hasSize(2);
        JsonNode outer = polygon.get("coordinates").get(0);
        assertThat(outer.get(1).get(0).asDouble()).isEqualTo(10.0);
        assertThat(outer.get(1).get(1).asDouble()).isEqualTo(0.0);
    }

    @Test
    void twoOuterRingsBecomeMultiPolygon() throws Exception {
        JsonNode geometry = objectMapper.readTree("""
            {"rings":[
              [[0,0],[0,1],[1,1],[1,0],[0,0]],
              [[5,5],[5,6],[6,6],[6,5]]
            ]}
            """);

        JsonNode multi = converter.toGeometry(geometry);

        assertThat(multi.get("type").asText()).isEqualTo("MultiPolygon");
        assertThat(multi.get("coordinates")).hasSize(2);
        assertThat(multi.get("coordinates").get(1).get(0)).hasSize(5);
    }

    @Test
    void featureWithoutGeometryKeepsNullGeometry() throws Exception {
        JsonNode featureSet = objectMapper.readTree("{\"features\":[{\"attributes\":{\"OBJECTID\":1}}]}");
        JsonNode feature = converter.toFeatureCollection(featureSet).get("features").get(0);

        assertThat(feature.get("geometry").isNull()).isTrue();
        assertThat(feature.get("id").asInt()).isEqualTo(1);
    }

    @Test
    void rejectsPayloadWithoutFeatures() throws Exception {
        assertThatThrownBy(() -> converter.toFeatureCollection(objectMapper.readTree("{\"count\":5}")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
