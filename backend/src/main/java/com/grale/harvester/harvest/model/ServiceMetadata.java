package com.grale.harvester.harvest.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public record ServiceMetadata(
    String name,
    String layerId,
    Integer maxRecordCount,
    List<String> supportedQueryFormats,
    String wkid,
    JsonNode document
) {
    public boolean supportsFormat(String format) {
        if (format == null || supportedQueryFormats == null) {
            return false;
        }
        String wanted = format.trim().toLowerCase(Locale.ROOT);
        return supportedQueryFormats.stream().anyMatch(candidate -> candidate.equalsIgnoreCase(wanted));
    }

    public String layerNameOr(String fallback) {
        return name == null || name.isBlank() ? fallback : name;
    }

    public static List<String> splitFormats(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toList();
    }
}
