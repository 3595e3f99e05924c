package com.grale.harvester.harvest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grale.harvester.config.HarvesterProperties;
import com.grale.harvester.harvest.esri.FeatureServiceProbe;
import com.grale.harvester.harvest.http.SessionProvider;
import com.grale.harvester.harvest.log.RequestLog;
import com.grale.harvester.harvest.merge.FeatureMerger;
import com.grale.harvester.harvest.model.Chunk;
import com.grale.harvester.harvest.model.HarvestRequest;
import com.grale.harvester.harvest.model.HarvestResult;
import com.grale.harvester.harvest.model.MergedOutput;
import com.grale.harvester.harvest.model.OutputMode;
import com.grale.harvester.harvest.model.ProbeResult;
import com.grale.harvester.harvest.model.QueryParameters;
import com.grale.harvester.harvest.model.ServiceMetadata;
import com.grale.harvester.harvest.plan.ChunkPlanner;
import com.grale.harvester.harvest.sink.ResultSink;
import com.grale.harvester.harvest.sink.ResultSinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Top-level paginated harvest: probe, plan, dispatch, merge. Anything that goes
 * wrong before dispatch is thrown to the caller; per-chunk failures only show up
 * in the request log and the returned counts.
 */
@Service
public class HarvestService {
    private static final Logger log = LoggerFactory.getLogger(HarvestService.class);
    private static final String FALLBACK_LAYER_NAME = "layer";

    private final HarvesterProperties properties;
    private final FeatureServiceProbe probe;
    private final ChunkPlanner planner;
    private final HarvestOrchestrator orchestrator;
    private final FeatureMerger merger;
    private final ResultSinkFactory sinkFactory;
    private final SessionProvider sessionProvider;
    private final RequestLog defaultLog;
    private final Clock clock;

    public HarvestService(
        HarvesterProperties properties,
        FeatureServiceProbe probe,
        ChunkPlanner planner,
        HarvestOrchestrator orchestrator,
        FeatureMerger merger,
        ResultSinkFactory sinkFactory,
        SessionProvider sessionProvider,
        RequestLog defaultLog,
        Clock clock
    ) {
        this.properties = properties;
        this.probe = probe;
        this.planner = planner;
        this.orchestrator = orchestrator;
        this.merger = merger;
        this.sinkFactory = sinkFactory;
        this.sessionProvider = sessionProvider;
        this.defaultLog = defaultLog;
        this.clock = clock;
    }

    public HarvestResult harvest(HarvestRequest request) {
        return harvest(request, UUID.randomUUID().toString(), HarvestCancellation.none());
    }

    public HarvestResult harvest(HarvestRequest request, String ppid, HarvestCancellation cancellation) {
        String serviceUrl = validate(request);
        QueryParameters query = request.queryOrDefaults();
        RequestLog requestLog = request.requestLog() == null ? defaultLog : request.requestLog();
        Instant startedAt = clock.instant();

        ProbeResult probed = probe.probe(sessionProvider, serviceUrl, query.whereOrDefault());
        ServiceMetadata metadata = probed.metadata();
        String layerName = metadata.layerNameOr(FALLBACK_LAYER_NAME);
        JsonNode metadataDocument = metadataDocument(metadata, ppid);
        List<JsonNode> requestMetadata = metadataDocument == null ? List.of() : List.of(metadataDocument);

        long total = probed.totalCount();
        if (query.maxRecords() != null) {
            total = Math.min(total, Math.max(0L, query.maxRecords()));
        }
        if (total == 0) {
            log.info("No records returned for {}", serviceUrl);
            return emptyResult(ppid, layerName, startedAt, 0L, requestMetadata);
        }

        List<Chunk> chunks = planner.plan(total, query.startOffset(), request.chunkSize(), probed.maxPageSize(), ppid);
        if (chunks.isEmpty()) {
            return emptyResult(ppid, layerName, startedAt, total, requestMetadata);
        }
        int pageSize = planner.effectivePageSize(request.chunkSize(), probed.maxPageSize());
        long requested = total - query.startOffset();
        log.info("Pull will require {} request(s)", chunks.size());
        log.info("Requesting: {} out of {} total features", requested, total);
        log.info("Chunk size set at: {} features", pageSize);

        boolean geoJson = useGeoJson(query, metadata);
        OutputMode mode = request.outputMode() == null ? properties.getOutputMode() : request.outputMode();
        Path spillDirectory = request.spillDirectory() == null ? properties.spillDirectoryPath() : request.spillDirectory();
        ResultSink sink = createSink(mode, spillDirectory, layerName);

        DispatchContext context = new DispatchContext(
            ppid,
            serviceUrl + "/query",
            baseParameters(query, geoJson),
            !geoJson,
            request.maxWorkers(),
            requestLog,
            sink,
            sessionProvider,
            cancellation
        );
        DispatchReport report = orchestrator.dispatch(chunks, context);
        log.info("Returned: {} of {} requested features", report.returnedFeatures(), requested);
        String usage = sink.describeUsage();
        if (usage != null) {
            log.info(usage);
        }

        boolean cleanup = request.cleanup() == null ? properties.isCleanup() : request.cleanup();
        MergedOutput output = merger.merge(report.results(), ppid, requestLog, requestMetadata, sink, cleanup);

        String status;
        if (report.wasCancelled()) {
            status = HarvestResult.CANCELLED;
        } else if (report.failed() > 0) {
            status = HarvestResult.COMPLETED_WITH_ERRORS;
        } else {
            status = HarvestResult.COMPLETED;
        }
        return new HarvestResult(
            ppid,
            layerName,
            status,
            startedAt,
            clock.instant(),
            total,
            requested,
            output.featureCount(),
            chunks.size(),
            report.succeeded(),
            report.failed(),
            report.skipped().stream().map(Chunk::ownId).toList(),
            HarvestResult.summaryLine(output.featureCount(), requested),
            output
        );
    }

    String validate(HarvestRequest request) {
        if (request == null) {
            throw new InvalidHarvestRequestException("Harvest request is required");
        }
        String serviceUrl = request.normalizedServiceUrl();
        if (serviceUrl == null || serviceUrl.isBlank()) {
            throw new InvalidHarvestRequestException("Service url is required");
        }
        URI uri;
        try {
            uri = new URI(serviceUrl);
        } catch (URISyntaxException e) {
            throw new InvalidHarvestRequestException("Service url is not a valid URI: " + serviceUrl, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
            throw new InvalidHarvestRequestException("Service url must be an absolute http(s) url: " + serviceUrl);
        }
        if (request.chunkSize() != null && request.chunkSize() <= 0) {
            throw new InvalidHarvestRequestException("Chunk size must be positive but was " + request.chunkSize());
        }
        if (request.maxWorkers() != null && request.maxWorkers() <= 0) {
            throw new InvalidHarvestRequestException("Max workers must be positive but was " + request.maxWorkers());
        }
        return serviceUrl;
    }

    Map<String, String> baseParameters(QueryParameters query, boolean geoJson) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("where", query.whereOrDefault());
        params.put("outFields", query.outFieldsOrDefault());
        params.put("outSR", query.outSrOr(properties.getDefaultOutSr()));
        for (Map.Entry<String, String> extra : query.extraOrEmpty().entrySet()) {
            if (isPagination(extra.getKey())) {
                continue;
            }
            params.putIfAbsent(extra.getKey(), extra.getValue());
        }
        params.put("f", geoJson ? QueryParameters.FORMAT_GEOJSON : QueryParameters.FORMAT_JSON);
        return params;
    }

    private boolean useGeoJson(QueryParameters query, ServiceMetadata metadata) {
        String format = query.formatOrDefault();
        if (QueryParameters.FORMAT_GEOJSON.equals(format)) {
            if (metadata.supportsFormat(QueryParameters.FORMAT_GEOJSON)) {
                return true;
            }
            log.warn("geojson is not supported on this service (supported: {}); requesting json", metadata.supportedQueryFormats());
            return false;
        }
        if (!QueryParameters.FORMAT_JSON.equals(format)) {
            log.warn("Unsupported query format {} requested; requesting json", format);
        } else if (!metadata.supportedQueryFormats().isEmpty() && !metadata.supportsFormat(QueryParameters.FORMAT_JSON)) {
            log.warn("json is not listed as supported on this service (supported: {})", metadata.supportedQueryFormats());
        }
        return false;
    }

    private boolean isPagination(String name) {
        return HarvestOrchestrator.RESULT_OFFSET.equalsIgnoreCase(name)
            || HarvestOrchestrator.RESULT_RECORD_COUNT.equalsIgnoreCase(name)
            || "f".equalsIgnoreCase(name);
    }

    private ResultSink createSink(OutputMode mode, Path spillDirectory, String layerName) {
        try {
            return sinkFactory.create(mode, spillDirectory, layerName);
        } catch (IOException e) {
            throw new InvalidHarvestRequestException("Spill directory cannot be used: " + spillDirectory, e);
        }
    }

    private JsonNode metadataDocument(ServiceMetadata metadata, String ppid) {
        ObjectNode document = metadata.document() != null && metadata.document().isObject()
            ? ((ObjectNode) metadata.document()).deepCopy()
            : null;
        if (document == null) {
            return null;
        }
        document.put("ppid", ppid);
        return document;
    }

    private HarvestResult emptyResult(
        String ppid,
        String layerName,
        Instant startedAt,
        long total,
        List<JsonNode> requestMetadata
    ) {
        return new HarvestResult(
            ppid,
            layerName,
            HarvestResult.NO_RECORDS,
            startedAt,
            clock.instant(),
            total,
            0L,
            0L,
            0,
            0,
            0,
            List.of(),
            HarvestResult.summaryLine(0L, 0L),
            MergedOutput.empty(requestMetadata)
        );
    }
}
