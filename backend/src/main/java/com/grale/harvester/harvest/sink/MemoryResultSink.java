package com.grale.harvester.harvest.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.model.Chunk;
import com.grale.harvester.harvest.model.ChunkResult;
import com.grale.harvester.harvest.model.LogEntry;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class MemoryResultSink implements ResultSink {
    private final ObjectMapper objectMapper;
    private final Map<String, JsonNode> payloads = new ConcurrentHashMap<>();

    public MemoryResultSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ChunkResult put(Chunk chunk, LogEntry entry, JsonNode payload) {
        JsonNode previous = payloads.putIfAbsent(chunk.ownId(), payload);
        if (previous != null) {
            throw new IllegalStateException("Payload already stored for chunk " + chunk.ownId());
        }
        return ChunkResult.inMemory(chunk, entry.status(), FeaturePayloads.featureCount(payload));
    }

    @Override
    public byte[] read(ChunkResult result) throws IOException {
        return objectMapper.writeValueAsBytes(load(result));
    }

    @Override
    public JsonNode load(ChunkResult result) throws IOException {
        JsonNode payload = payloads.get(result.pid());
        if (payload == null) {
            throw new IOException("No payload stored for chunk " + result.pid());
        }
        return payload;
    }

    @Override
    public void cleanup() {
        payloads.clear();
    }

    public int size() {
        return payloads.size();
    }
}
