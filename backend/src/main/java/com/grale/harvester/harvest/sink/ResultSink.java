package com.grale.harvester.harvest.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.grale.harvester.harvest.model.Chunk;
import com.grale.harvester.harvest.model.ChunkResult;
import com.grale.harvester.harvest.model.LogEntry;

import java.io.IOException;

/**
 * Holds one payload per chunk for the lifetime of a harvest. A chunk id can be
 * written once; a second write for the same id is rejected.
 */
public interface ResultSink {

    ChunkResult put(Chunk chunk, LogEntry entry, JsonNode payload) throws IOException;

    byte[] read(ChunkResult result) throws IOException;

    JsonNode load(ChunkResult result) throws IOException;

    default void cleanup() {
    }

    default String describeUsage() {
        return null;
    }
}
