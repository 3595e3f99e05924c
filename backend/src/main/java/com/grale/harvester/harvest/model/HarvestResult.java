package com.grale.harvester.harvest.model;

import java.time.Instant;
import java.util.List;

public record HarvestResult(
    String ppid,
    String layerName,
    String status,
    Instant startedAt,
    Instant finishedAt,
    long totalRecords,
    long requestedFeatures,
    long returnedFeatures,
    int chunksPlanned,
    int chunksSucceeded,
    int chunksFailed,
    List<String> skippedChunks,
    String summary,
    MergedOutput output
) {
    public static final String COMPLETED = "COMPLETED";
    public static final String COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    public static final String CANCELLED = "CANCELLED";
    public static final String NO_RECORDS = "NO_RECORDS";

    public static String summaryLine(long returned, long requested) {
        return returned + " of " + requested + " features returned";
    }
}
