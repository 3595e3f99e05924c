package com.grale.harvester.harvest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.config.HarvesterProperties;
import com.grale.harvester.harvest.esri.EsriGeoJsonConverter;
import com.grale.harvester.harvest.http.RequestSpec;
import com.grale.harvester.harvest.http.SessionResponse;
import com.grale.harvester.harvest.log.LogStateException;
import com.grale.harvester.harvest.model.Chunk;
import com.grale.harvester.harvest.model.ChunkResult;
import com.grale.harvester.harvest.model.LogEntry;
import com.grale.harvester.harvest.model.OutcomeStatus;
import com.grale.harvester.harvest.sink.FeaturePayloads;
import com.grale.harvester.harvest.util.OutcomeClassifier;
import com.grale.harvester.harvest.util.QueryStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs planned chunks on a bounded worker pool. Each chunk is one request, one
 * lineage entry and one sink write; a failing chunk never stops its siblings.
 */
@Service
public class HarvestOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestrator.class);
    public static final String RESULT_OFFSET = "resultOffset";
    public static final String RESULT_RECORD_COUNT = "resultRecordCount";

    private final OutcomeClassifier classifier;
    private final EsriGeoJsonConverter converter;
    private final ObjectMapper objectMapper;
    private final int defaultMaxWorkers;

    public HarvestOrchestrator(
        OutcomeClassifier classifier,
        EsriGeoJsonConverter converter,
        ObjectMapper objectMapper,
        HarvesterProperties properties
    ) {
        this.classifier = classifier;
        this.converter = converter;
        this.objectMapper = objectMapper;
        this.defaultMaxWorkers = properties.resolvedMaxWorkers();
    }

    public int defaultMaxWorkers() {
        return defaultMaxWorkers;
    }

    public DispatchReport dispatch(List<Chunk> chunks, DispatchContext context) {
        if (chunks.isEmpty()) {
            return DispatchReport.empty();
        }
        int bound = context.maxWorkers() == null ? defaultMaxWorkers : Math.max(1, context.maxWorkers());
        int workers = Math.min(bound, chunks.size());
        HarvestCancellation cancellation = context.cancellationOrNone();
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory(context.ppid()));
        try {
            List<CompletableFuture<ChunkResult>> futures = new ArrayList<>();
            for (Chunk chunk : chunks) {
                futures.add(CompletableFuture.supplyAsync(
                    () -> cancellation.isCancelled() ? null : runChunk(chunk, context),
                    pool
                ));
            }

            List<ChunkResult> results = new ArrayList<>();
            List<Chunk> skipped = new ArrayList<>();
            int succeeded = 0;
            int failed = 0;
            long returned = 0;
            for (int i = 0; i < futures.size(); i++) {
                Chunk chunk = chunks.get(i);
                ChunkResult result;
                try {
                    result = futures.get(i).join();
                } catch (CompletionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof LogStateException logStateException) {
                        throw logStateException;
                    }
                    log.warn("Chunk task failed unexpectedly ({})", chunk.describe(), cause);
                    result = ChunkResult.failed(chunk, OutcomeStatus.UNIDENTIFIED_ERROR);
                }
                if (result == null) {
                    skipped.add(chunk);
                    continue;
                }
                results.add(result);
                if (result.isSuccess()) {
                    succeeded++;
                    returned += result.featureCount();
                } else {
                    failed++;
                }
            }
            if (!skipped.isEmpty()) {
                log.warn(
                    "Harvest {} cancelled: skipped {} of {} chunk(s) starting at offsets {}",
                    context.ppid(),
                    skipped.size(),
                    chunks.size(),
                    skipped.stream().map(Chunk::offset).toList()
                );
            }
            return new DispatchReport(results, skipped, succeeded, failed, returned);
        } finally {
            pool.shutdown();
        }
    }

    ChunkResult runChunk(Chunk chunk, DispatchContext context) {
        Map<String, String> params = new LinkedHashMap<>(context.baseParameters());
        params.put(RESULT_OFFSET, Long.toString(chunk.offset()));
        params.put(RESULT_RECORD_COUNT, Integer.toString(chunk.limit()));
        String url = QueryStrings.prepare(context.queryUrl(), params);
        String pid = context.requestLog().create(chunk.parentId(), chunk.ownId(), QueryStrings.parse(url), url);

        OutcomeClassifier.Outcome outcome;
        JsonNode payload = null;
        try {
            SessionResponse response = context.session().execute(RequestSpec.json(url));
            outcome = classifier.classify(response);
            if (outcome.isSuccess()) {
                try {
                    payload = toFeatureCollection(outcome.body(), context.convertEsriJson());
                } catch (RuntimeException e) {
                    outcome = classifier.unidentified(outcome, "Payload could not be read as features: " + e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            log.warn("Request failed for chunk {}", chunk.describe(), e);
            outcome = new OutcomeClassifier.Outcome(
                OutcomeStatus.UNIDENTIFIED_ERROR,
                List.of(String.valueOf(e.getMessage())),
                0L,
                0L,
                null
            );
        }

        LogEntry entry = context.requestLog().complete(
            pid,
            outcome.status(),
            outcome.results(),
            outcome.elapsedMillis(),
            outcome.sizeBytes()
        );
        log.info("-{} |:| {}", entry.status(), String.join(" ", entry.results()));

        JsonNode stored = payload == null ? FeaturePayloads.emptyCollection(objectMapper) : payload;
        try {
            return context.sink().put(chunk, entry, stored);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not store payload for chunk {}", chunk.describe(), e);
            return ChunkResult.failed(chunk, OutcomeStatus.UNIDENTIFIED_ERROR);
        }
    }

    private JsonNode toFeatureCollection(JsonNode body, boolean convertEsriJson) {
        if (convertEsriJson) {
            return converter.toFeatureCollection(body);
        }
        JsonNode features = body == null ? null : body.get("features");
        if (features == null || !features.isArray()) {
            throw new IllegalArgumentException("GeoJSON payload has no features array");
        }
        return body;
    }

    private ThreadFactory threadFactory(String ppid) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "harvest-" + (ppid == null ? "run" : ppid.substring(0, Math.min(8, ppid.length())));
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
