package com.grale.harvester.harvest.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grale.harvester.harvest.log.RequestLog;
import com.grale.harvester.harvest.model.ChunkResult;
import com.grale.harvester.harvest.model.LogEntry;
import com.grale.harvester.harvest.model.LogEntryView;
import com.grale.harvester.harvest.model.MergedOutput;
import com.grale.harvester.harvest.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Combines chunk payloads into one lineage-tagged FeatureCollection. Payloads are
 * read in chunk offset order, whatever order the chunks completed in.
 */
@Component
public class FeatureMerger {
    private static final Logger log = LoggerFactory.getLogger(FeatureMerger.class);
    public static final String GRALE_UTC = "grale_utc";
    public static final String GRALE_UUID = "grale_uuid";

    public MergedOutput merge(
        List<ChunkResult> results,
        String ppid,
        RequestLog requestLog,
        List<JsonNode> metadata,
        ResultSink sink,
        boolean cleanup
    ) {
        try {
            return doMerge(results, ppid, requestLog, metadata, sink);
        } finally {
            if (cleanup) {
                sink.cleanup();
            }
        }
    }

    private MergedOutput doMerge(
        List<ChunkResult> results,
        String ppid,
        RequestLog requestLog,
        List<JsonNode> metadata,
        ResultSink sink
    ) {
        List<ChunkResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingLong(result -> result.chunk().offset()));

        List<JsonNode> features = new ArrayList<>();
        List<LogEntryView> logging = new ArrayList<>();
        Set<String> seenPids = new LinkedHashSet<>();
        for (ChunkResult result : ordered) {
            Optional<LogEntry> entry = requestLog.find(result.pid());
            entry.ifPresent(found -> {
                logging.add(found.toView());
                seenPids.add(found.pid());
            });
            if (!result.isSuccess() || entry.isEmpty()) {
                continue;
            }
            JsonNode payload;
            try {
                payload = sink.load(result);
            } catch (IOException e) {
                log.warn("Could not read payload for chunk {}", result.chunk().describe(), e);
                continue;
            }
            for (JsonNode feature : payload.path("features")) {
                if (feature.isObject()) {
                    features.add(tag((ObjectNode) feature.deepCopy(), entry.get()));
                }
            }
        }

        for (LogEntry other : requestLog.snapshot(ppid)) {
            if (!seenPids.contains(other.pid())) {
                logging.add(other.toView());
            }
        }
        List<JsonNode> requestMetadata = metadata == null ? List.of() : List.copyOf(metadata);
        return new MergedOutput(MergedOutput.FEATURE_COLLECTION, features, logging, requestMetadata);
    }

    private ObjectNode tag(ObjectNode feature, LogEntry entry) {
        JsonNode properties = feature.get("properties");
        ObjectNode target = properties != null && properties.isObject()
            ? (ObjectNode) properties
            : feature.putObject("properties");
        target.put(GRALE_UTC, entry.utcTimestamp().toString());
        target.put(GRALE_UUID, entry.graleId());
        return feature;
    }
}
