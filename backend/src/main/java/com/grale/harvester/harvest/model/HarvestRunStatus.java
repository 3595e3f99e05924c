package com.grale.harvester.harvest.model;

import java.time.Instant;

public record HarvestRunStatus(
    String ppid,
    String serviceUrl,
    String state,
    Instant submittedAt,
    boolean cancelRequested,
    String error,
    HarvestResult result
) {
    public static final String RUNNING = "RUNNING";
    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";
}
