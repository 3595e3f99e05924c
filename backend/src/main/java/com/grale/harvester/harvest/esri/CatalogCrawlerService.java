package com.grale.harvester.harvest.esri;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grale.harvester.harvest.http.RequestSpec;
import com.grale.harvester.harvest.http.SessionProvider;
import com.grale.harvester.harvest.http.SessionResponse;
import com.grale.harvester.harvest.log.RequestLog;
import com.grale.harvester.harvest.model.CatalogSnapshot;
import com.grale.harvester.harvest.model.QueryParameters;
import com.grale.harvester.harvest.util.OutcomeClassifier;
import com.grale.harvester.harvest.util.QueryStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Sequential, read-only walk of an ArcGIS REST catalog: root folders, the
 * services inside them, and the layers and tables each service exposes.
 */
@Service
public class CatalogCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(CatalogCrawlerService.class);
    public static final String ROOT_FOLDER = "services";
    public static final String SOURCE_DEFINITION = "source_definition";

    private final SessionProvider sessionProvider;
    private final OutcomeClassifier classifier;
    private final RequestLog defaultLog;
    private final Supplier<String> idGenerator;

    @Autowired
    public CatalogCrawlerService(SessionProvider sessionProvider, OutcomeClassifier classifier, RequestLog defaultLog) {
        this(sessionProvider, classifier, defaultLog, () -> UUID.randomUUID().toString());
    }

    CatalogCrawlerService(
        SessionProvider sessionProvider,
        OutcomeClassifier classifier,
        RequestLog defaultLog,
        Supplier<String> idGenerator
    ) {
        this.sessionProvider = sessionProvider;
        this.classifier = classifier;
        this.defaultLog = defaultLog;
        this.idGenerator = idGenerator;
    }

    public CatalogSnapshot crawl(String restRoot, List<String> folders, List<String> serviceTypes, RequestLog requestLog) {
        RequestLog target = requestLog == null ? defaultLog : requestLog;
        String root = trimSlashes(restRoot);
        String ppid = idGenerator.get();

        Map<String, JsonNode> services = listServices(root, safe(folders), safe(serviceTypes), ppid, target);
        Map<String, JsonNode> dataSources = dataSources(services);
        Map<String, JsonNode> definitions = dataSourceDefinitions(dataSources, ppid, target);
        log.info("Catalog crawl of {} found {} service(s) and {} data source(s)", root, services.size(), definitions.size());
        return new CatalogSnapshot(ppid, root, services, definitions);
    }

    public Map<String, JsonNode> listServices(
        String root,
        List<String> folders,
        List<String> serviceTypes,
        String ppid,
        RequestLog requestLog
    ) {
        JsonNode catalog = fetch(root + "/" + ROOT_FOLDER, ppid, requestLog);
        if (catalog == null) {
            throw new ProbeException("Catalog root could not be read: " + root + "/" + ROOT_FOLDER);
        }

        List<String> directories = new ArrayList<>();
        boolean includeRoot = folders.isEmpty() || folders.contains(ROOT_FOLDER);
        if (includeRoot && catalog.path("services").size() > 0) {
            directories.add(ROOT_FOLDER);
        }
        for (JsonNode folder : catalog.path("folders")) {
            String name = folder.asText();
            if (folders.isEmpty() || folders.contains(name)) {
                directories.add(name);
            }
        }

        Map<String, JsonNode> definitions = new LinkedHashMap<>();
        for (String directory : directories) {
            JsonNode listing = ROOT_FOLDER.equals(directory)
                ? catalog
                : fetch(root + "/" + ROOT_FOLDER + "/" + directory, ppid, requestLog);
            if (listing == null) {
                log.warn("Skipping catalog folder {} after a failed listing", directory);
                continue;
            }
            for (JsonNode service : listing.path("services")) {
                String type = service.path("type").asText();
                if (!serviceTypes.isEmpty() && !serviceTypes.contains(type)) {
                    continue;
                }
                String serviceUrl = root + "/" + ROOT_FOLDER + "/" + service.path("name").asText() + "/" + type;
                JsonNode definition = fetch(serviceUrl, ppid, requestLog);
                if (definition != null) {
                    definitions.put(serviceUrl, definition);
                }
            }
        }
        return definitions;
    }

    public Map<String, JsonNode> dataSources(Map<String, JsonNode> serviceDefinitions) {
        Map<String, JsonNode> sources = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : serviceDefinitions.entrySet()) {
            for (String kind : new String[]{"layers", "tables"}) {
                for (JsonNode source : entry.getValue().path(kind)) {
                    if (source.hasNonNull("id")) {
                        sources.put(entry.getKey() + "/" + source.get("id").asText(), source);
                    }
                }
            }
        }
        return sources;
    }

    public Map<String, JsonNode> dataSourceDefinitions(Map<String, JsonNode> dataSources, String ppid, RequestLog requestLog) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : dataSources.entrySet()) {
            ObjectNode copy = entry.getValue().deepCopy();
            JsonNode definition = fetch(entry.getKey(), ppid, requestLog);
            if (definition != null) {
                copy.set(SOURCE_DEFINITION, definition);
            }
            out.put(entry.getKey(), copy);
        }
        return out;
    }

    private JsonNode fetch(String url, String ppid, RequestLog requestLog) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("f", QueryParameters.FORMAT_JSON);
        String prepared = QueryStrings.prepare(url, params);
        String pid = requestLog.create(ppid, QueryStrings.parse(prepared), prepared);
        SessionResponse response = sessionProvider.execute(RequestSpec.json(prepared));
        OutcomeClassifier.Outcome outcome = classifier.classify(response);
        requestLog.complete(pid, outcome.status(), outcome.results(), outcome.elapsedMillis(), outcome.sizeBytes());
        log.debug("-{} |:| {}", outcome.status(), url);
        return outcome.isSuccess() ? outcome.body() : null;
    }

    private static List<String> safe(List<String> values) {
        return values == null ? List.of() : values;
    }

    private static String trimSlashes(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
