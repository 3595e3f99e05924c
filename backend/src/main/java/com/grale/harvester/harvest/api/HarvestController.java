package com.grale.harvester.harvest.api;

import com.grale.harvester.harvest.esri.CatalogCrawlerService;
import com.grale.harvester.harvest.log.RequestLog;
import com.grale.harvester.harvest.model.CatalogSnapshot;
import com.grale.harvester.harvest.model.HarvestResult;
import com.grale.harvester.harvest.model.HarvestRunStatus;
import com.grale.harvester.harvest.model.LogEntry;
import com.grale.harvester.harvest.model.LogEntryView;
import com.grale.harvester.harvest.service.HarvestRunRegistry;
import com.grale.harvester.harvest.service.HarvestService;
import com.grale.harvester.harvest.service.InvalidHarvestRequestException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class HarvestController {
    private final HarvestService harvestService;
    private final HarvestRunRegistry runRegistry;
    private final CatalogCrawlerService catalogCrawlerService;
    private final RequestLog requestLog;

    public HarvestController(
        HarvestService harvestService,
        HarvestRunRegistry runRegistry,
        CatalogCrawlerService catalogCrawlerService,
        RequestLog requestLog
    ) {
        this.harvestService = harvestService;
        this.runRegistry = runRegistry;
        this.catalogCrawlerService = catalogCrawlerService;
        this.requestLog = requestLog;
    }

    @PostMapping("/harvest")
    public HarvestResult harvest(@RequestBody(required = false) HarvestApiRequest request) {
        return harvestService.harvest(requireBody(request).toHarvestRequest());
    }

    @PostMapping("/harvest/async")
    public ResponseEntity<HarvestRunStatus> startHarvest(@RequestBody(required = false) HarvestApiRequest request) {
        return ResponseEntity.accepted().body(runRegistry.start(requireBody(request).toHarvestRequest()));
    }

    @GetMapping("/harvest/{ppid}")
    public HarvestRunStatus getHarvest(@PathVariable("ppid") String ppid) {
        return runRegistry.status(ppid);
    }

    @PostMapping("/harvest/{ppid}/cancel")
    public HarvestRunStatus cancelHarvest(@PathVariable("ppid") String ppid) {
        return runRegistry.cancel(ppid);
    }

    @GetMapping("/logs")
    public List<LogEntryView> getLogs(@RequestParam(name = "ppid", required = false) String ppid) {
        List<LogEntry> entries = ppid == null || ppid.isBlank() ? requestLog.snapshot() : requestLog.snapshot(ppid);
        return entries.stream().map(LogEntry::toView).toList();
    }

    @GetMapping("/catalog")
    public CatalogSnapshot crawlCatalog(
        @RequestParam(name = "url") String url,
        @RequestParam(name = "folders", required = false) List<String> folders,
        @RequestParam(name = "serviceTypes", required = false) List<String> serviceTypes
    ) {
        if (url.isBlank()) {
            throw new InvalidHarvestRequestException("url is required");
        }
        return catalogCrawlerService.crawl(url, folders, serviceTypes, null);
    }

    private HarvestApiRequest requireBody(HarvestApiRequest request) {
        if (request == null) {
            throw new InvalidHarvestRequestException("Request body with a service url is required");
        }
        return request;
    }
}
