package com.grale.harvester.harvest.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.model.Chunk;
import com.grale.harvester.harvest.model.ChunkResult;
import com.grale.harvester.harvest.model.LogEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryResultSinkTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void storesPayloadPerChunkAndRejectsSecondWrite() throws Exception {
        MemoryResultSink sink = new MemoryResultSink(objectMapper);
        Chunk chunk = new Chunk(0, 2, "ppid", "pid-1");
        JsonNode payload = objectMapper.readTree("{\"type\":\"FeatureCollection\",\"features\":[{},{}]}");

        ChunkResult result = sink.put(chunk, entry("pid-1"), payload);

        assertThat(result.featureCount()).isEqualTo(2);
        assertThat(result.isSpilled()).isFalse();
        assertThat(sink.load(result)).isSameAs(payload);
        assertThat(objectMapper.readTree(sink.read(result))).isEqualTo(payload);
        assertThatThrownBy(() -> sink.put(chunk, entry("pid-1"), payload)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cleanupDropsEverything() {
        MemoryResultSink sink = new MemoryResultSink(objectMapper);
        sink.put(new Chunk(0, 1, "p", "a"), entry("a"), FeaturePayloads.emptyCollection(objectMapper));
        sink.cleanup();
        assertThat(sink.size()).isZero();
    }

    private LogEntry entry(String pid) {
        return LogEntry.inFlight(pid, "ppid", Instant.parse("2024-01-01T00:00:00Z"), Map.of(), "u")
            .complete("Success", List.of(), 1, 1);
    }
}
