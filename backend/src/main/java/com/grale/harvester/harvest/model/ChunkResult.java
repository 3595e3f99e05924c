package com.grale.harvester.harvest.model;

import java.nio.file.Path;

public record ChunkResult(
    Chunk chunk,
    String status,
    int featureCount,
    Path artifact,
    boolean compressed
) {
    public static ChunkResult inMemory(Chunk chunk, String status, int featureCount) {
        return new ChunkResult(chunk, status, featureCount, null, false);
    }

    public static ChunkResult spilled(Chunk chunk, String status, int featureCount, Path artifact) {
        return new ChunkResult(chunk, status, featureCount, artifact, true);
    }

    public static ChunkResult failed(Chunk chunk, String status) {
        return new ChunkResult(chunk, status, 0, null, false);
    }

    public String pid() {
        return chunk.ownId();
    }

    public boolean isSuccess() {
        return OutcomeStatus.SUCCESS.equals(status);
    }

    public boolean isSpilled() {
        return artifact != null;
    }
}
