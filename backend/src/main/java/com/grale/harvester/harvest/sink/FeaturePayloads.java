package com.grale.harvester.harvest.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grale.harvester.harvest.model.MergedOutput;

public final class FeaturePayloads {
    private FeaturePayloads() {
    }

    public static int featureCount(JsonNode payload) {
        if (payload == null) {
            return 0;
        }
        JsonNode features = payload.get("features");
        return features != null && features.isArray() ? features.size() : 0;
    }

    public static ObjectNode emptyCollection(ObjectMapper objectMapper) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", MergedOutput.FEATURE_COLLECTION);
        node.putArray("features");
        return node;
    }
}
