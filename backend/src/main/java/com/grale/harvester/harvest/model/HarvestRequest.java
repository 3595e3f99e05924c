package com.grale.harvester.harvest.model;

import com.grale.harvester.harvest.log.RequestLog;

import java.nio.file.Path;

public record HarvestRequest(
    String serviceUrl,
    QueryParameters query,
    Integer chunkSize,
    Integer maxWorkers,
    OutputMode outputMode,
    RequestLog requestLog,
    Boolean cleanup,
    Path spillDirectory
) {
    public static HarvestRequest of(String serviceUrl) {
        return new HarvestRequest(serviceUrl, QueryParameters.defaults(), null, null, null, null, null, null);
    }

    public QueryParameters queryOrDefaults() {
        return query == null ? QueryParameters.defaults() : query;
    }

    public String normalizedServiceUrl() {
        if (serviceUrl == null) {
            return null;
        }
        String value = serviceUrl.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
