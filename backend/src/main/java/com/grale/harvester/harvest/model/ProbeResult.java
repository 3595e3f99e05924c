package com.grale.harvester.harvest.model;

public record ProbeResult(
    long totalCount,
    Integer maxPageSize,
    ServiceMetadata metadata
) {
}
