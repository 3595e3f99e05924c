package com.grale.harvester.harvest.model;

public record Chunk(
    long offset,
    int limit,
    String parentId,
    String ownId
) {
    public long endOffset() {
        return offset + limit;
    }

    public String describe() {
        return "offset=" + offset + ", limit=" + limit + ", pid=" + ownId;
    }
}
