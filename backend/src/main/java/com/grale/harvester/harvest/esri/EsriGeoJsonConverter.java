package com.grale.harvester.harvest.esri;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grale.harvester.harvest.model.MergedOutput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Converts an ESRI JSON feature set into a GeoJSON FeatureCollection.
 *
 * <p>Polygon rings are sorted by winding: clockwise rings are outer rings,
 * counter-clockwise rings are holes assigned to the outer ring that contains
 * them. Output rings follow the GeoJSON right-hand rule.
 */
@Component
public class EsriGeoJsonConverter {
    private static final String[] ID_FIELDS = {"OBJECTID", "FID"};

    private final ObjectMapper objectMapper;

    public EsriGeoJsonConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toFeatureCollection(JsonNode featureSet) {
        if (featureSet == null || !featureSet.isObject()) {
            throw new IllegalArgumentException("Feature set is not a JSON object");
        }
        JsonNode features = featureSet.get("features");
        if (features == null || !features.isArray()) {
            throw new IllegalArgumentException("Feature set has no features array");
        }
        String idField = featureSet.hasNonNull("objectIdFieldName")
            ? featureSet.get("objectIdFieldName").asText()
            : null;

        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("type", MergedOutput.FEATURE_COLLECTION);
        ArrayNode out = collection.putArray("features");
        for (JsonNode feature : features) {
            out.add(toFeature(feature, idField));
        }
        return collection;
    }

    public ObjectNode toFeature(JsonNode esriFeature, String idField) {
        ObjectNode feature = objectMapper.createObjectNode();
        feature.put("type", "Feature");
        JsonNode geometry = esriFeature.get("geometry");
        feature.set("geometry", geometry == null || geometry.isNull() ? objectMapper.nullNode() : toGeometry(geometry));
        JsonNode attributes = esriFeature.get("attributes");
        if (attributes != null && attributes.isObject()) {
            feature.set("properties", attributes.deepCopy());
            JsonNode id = findId(attributes, idField);
            if (id != null) {
                feature.set("id", id.deepCopy());
            }
        } else {
            feature.set("properties", objectMapper.nullNode());
        }
        return feature;
    }

    public JsonNode toGeometry(JsonNode esri) {
        if (esri.hasNonNull("x") && esri.hasNonNull("y")) {
            ArrayNode coordinates = objectMapper.createArrayNode();
            coordinates.add(esri.get("x").asDouble());
            coordinates.add(esri.get("y").asDouble());
            if (esri.hasNonNull("z")) {
                coordinates.add(esri.get("z").asDouble());
            }
            return geometry("Point", coordinates);
        }
        if (esri.has("points")) {
            return geometry("MultiPoint", esri.get("points").deepCopy());
        }
        if (esri.has("paths")) {
            JsonNode paths = esri.get("paths");
            if (paths.size() == 1) {
                return geometry("LineString", paths.get(0).deepCopy());
            }
            return geometry("MultiLineString", paths.deepCopy());
        }
        if (esri.has("rings")) {
            return polygon(esri.get("rings"));
        }
        return objectMapper.nullNode();
    }

    private JsonNode polygon(JsonNode rings) {
        List<List<ArrayNode>> outerRings = new ArrayList<>();
        List<ArrayNode> holes = new ArrayList<>();
        for (JsonNode raw : rings) {
            ArrayNode ring = closeRing(raw);
            if (ring.size() < 4) {
                continue;
            }
            if (isClockwise(ring)) {
                List<ArrayNode> polygon = new ArrayList<>();
                polygon.add(reversed(ring));
                outerRings.add(polygon);
            } else {
                holes.add(reversed(ring));
            }
        }

        List<ArrayNode> orphans = new ArrayList<>();
        for (ArrayNode hole : holes) {
            boolean placed = false;
            for (int i = outerRings.size() - 1; i >= 0; i--) {
                List<ArrayNode> polygon = outerRings.get(i);
                if (contains(polygon.get(0), hole.get(0))) {
                    polygon.add(hole);
                    placed = true;
                    break;
                }
            }
            if (!placed) {
                orphans.add(hole);
            }
        }
        for (ArrayNode orphan : orphans) {
            List<ArrayNode> polygon = new ArrayList<>();
            polygon.add(reversed(orphan));
            outerRings.add(polygon);
        }

        if (outerRings.isEmpty()) {
            return objectMapper.nullNode();
        }
        if (outerRings.size() == 1) {
            return geometry("Polygon", toArray(outerRings.get(0)));
        }
        ArrayNode multi = objectMapper.createArrayNode();
        for (List<ArrayNode> polygon : outerRings) {
            multi.add(toArray(polygon));
        }
        return geometry("MultiPolygon", multi);
    }

    static boolean isClockwise(ArrayNode ring) {
        double total = 0;
        for (int i = 0; i < ring.size() - 1; i++) {
            JsonNode a = ring.get(i);
            JsonNode b = ring.get(i + 1);
            total += (b.get(0).asDouble() - a.get(0).asDouble()) * (b.get(1).asDouble() + a.get(1).asDouble());
        }
        return total >= 0;
    }

    static boolean contains(ArrayNode ring, JsonNode point) {
        double x = point.get(0).asDouble();
        double y = point.get(1).asDouble();
        boolean inside = false;
        for (int i = 0, j = ring.size() - 1; i < ring.size(); j = i++) {
            double xi = ring.get(i).get(0).asDouble();
            double yi = ring.get(i).get(1).asDouble();
            double xj = ring.get(j).get(0).asDouble();
            double yj = ring.get(j).get(1).asDouble();
            boolean crosses = (yi > y) != (yj > y) && x < (xj - xi) * (y - yi) / (yj - yi) + xi;
            if (crosses) {
                inside = !inside;
            }
        }
        return inside;
    }

    private ArrayNode closeRing(JsonNode ring) {
        ArrayNode copy = ring.deepCopy();
        if (copy.size() > 0 && !copy.get(0).equals(copy.get(copy.size() - 1))) {
            copy.add(copy.get(0).deepCopy());
        }
        return copy;
    }

    private ArrayNode reversed(ArrayNode ring) {
        ArrayNode out = objectMapper.createArrayNode();
        for (int i = ring.size() - 1; i >= 0; i--) {
            out.add(ring.get(i));
        }
        return out;
    }

    private ArrayNode toArray(List<ArrayNode> rings) {
        ArrayNode out = objectMapper.createArrayNode();
        out.addAll(rings);
        return out;
    }

    private ObjectNode geometry(String type, JsonNode coordinates) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type);
        node.set("coordinates", coordinates);
        return node;
    }

    private JsonNode findId(JsonNode attributes, String idField) {
        if (idField != null && attributes.hasNonNull(idField)) {
            return attributes.get(idField);
        }
        for (String candidate : ID_FIELDS) {
            if (attributes.hasNonNull(candidate)) {
                return attributes.get(candidate);
            }
        }
        Iterator<String> names = attributes.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.equalsIgnoreCase("objectid") && attributes.hasNonNull(name)) {
                return attributes.get(name);
            }
        }
        return null;
    }
}
