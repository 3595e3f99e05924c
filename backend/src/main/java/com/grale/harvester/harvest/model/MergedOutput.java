package com.grale.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonPropertyOrder({"type", "features", "request_logging", "request_metadata"})
public record MergedOutput(
    @JsonProperty("type") String type,
    @JsonProperty("features") List<JsonNode> features,
    @JsonProperty("request_logging") List<LogEntryView> requestLogging,
    @JsonProperty("request_metadata") List<JsonNode> requestMetadata
) {
    public static final String FEATURE_COLLECTION = "FeatureCollection";

    public static MergedOutput empty(List<JsonNode> requestMetadata) {
        return new MergedOutput(FEATURE_COLLECTION, List.of(), List.of(), requestMetadata);
    }

    public int featureCount() {
        return features == null ? 0 : features.size();
    }
}
