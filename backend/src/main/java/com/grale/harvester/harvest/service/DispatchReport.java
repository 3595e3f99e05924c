package com.grale.harvester.harvest.service;

import com.grale.harvester.harvest.model.Chunk;
import com.grale.harvester.harvest.model.ChunkResult;

import java.util.List;

public record DispatchReport(
    List<ChunkResult> results,
    List<Chunk> skipped,
    int succeeded,
    int failed,
    long returnedFeatures
) {
    public static DispatchReport empty() {
        return new DispatchReport(List.of(), List.of(), 0, 0, 0L);
    }

    public boolean wasCancelled() {
        return !skipped.isEmpty();
    }
}
