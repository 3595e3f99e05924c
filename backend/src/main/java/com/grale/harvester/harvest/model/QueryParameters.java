package com.grale.harvester.harvest.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record QueryParameters(
    String where,
    List<String> outFields,
    String outSr,
    Long resultOffset,
    Long maxRecords,
    String format,
    Map<String, String> extra
) {
    public static final String DEFAULT_WHERE = "1=1";
    public static final String ALL_FIELDS = "*";
    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_GEOJSON = "geojson";

    public static QueryParameters defaults() {
        return new QueryParameters(null, null, null, null, null, null, null);
    }

    public String whereOrDefault() {
        return where == null || where.isBlank() ? DEFAULT_WHERE : where.trim();
    }

    public String outFieldsOrDefault() {
        if (outFields == null || outFields.isEmpty()) {
            return ALL_FIELDS;
        }
        List<String> cleaned = outFields.stream()
            .filter(field -> field != null && !field.isBlank())
            .map(String::trim)
            .toList();
        return cleaned.isEmpty() ? ALL_FIELDS : String.join(", ", cleaned);
    }

    public String outSrOr(String fallback) {
        return outSr == null || outSr.isBlank() ? fallback : outSr.trim();
    }

    public long startOffset() {
        return resultOffset == null ? 0L : resultOffset;
    }

    public String formatOrDefault() {
        if (format == null || format.isBlank()) {
            return FORMAT_JSON;
        }
        return format.trim().toLowerCase(Locale.ROOT);
    }

    public Map<String, String> extraOrEmpty() {
        return extra == null ? Map.of() : new LinkedHashMap<>(extra);
    }
}
