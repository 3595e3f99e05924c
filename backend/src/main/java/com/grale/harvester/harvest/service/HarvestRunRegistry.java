package com.grale.harvester.harvest.service;

import com.grale.harvester.config.HarvesterProperties;
import com.grale.harvester.harvest.model.HarvestRequest;
import com.grale.harvester.harvest.model.HarvestResult;
import com.grale.harvester.harvest.model.HarvestRunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class HarvestRunRegistry {
    private static final Logger log = LoggerFactory.getLogger(HarvestRunRegistry.class);

    private final HarvestService harvestService;
    private final ExecutorService harvestRunExecutor;
    private final Clock clock;
    private final int retention;
    private final Map<String, Run> runs = new ConcurrentHashMap<>();
    private final AtomicLong finishSequence = new AtomicLong();

    public HarvestRunRegistry(
        HarvestService harvestService,
        @Qualifier("harvestRunExecutor") ExecutorService harvestRunExecutor,
        Clock clock,
        HarvesterProperties properties
    ) {
        this.harvestService = harvestService;
        this.harvestRunExecutor = harvestRunExecutor;
        this.clock = clock;
        this.retention = properties.getAsyncRetention();
    }

    public HarvestRunStatus start(HarvestRequest request) {
        harvestService.validate(request);
        String ppid = UUID.randomUUID().toString();
        Run run = new Run(ppid, request.normalizedServiceUrl(), clock.instant());
        runs.put(ppid, run);
        harvestRunExecutor.submit(() -> execute(run, request));
        return run.status();
    }

    public HarvestRunStatus status(String ppid) {
        return find(ppid).status();
    }

    public HarvestRunStatus cancel(String ppid) {
        Run run = find(ppid);
        if (run.cancellation.cancel()) {
            log.info("Cancellation requested for harvest {}", ppid);
        }
        return run.status();
    }

    private void execute(Run run, HarvestRequest request) {
        try {
            HarvestResult result = harvestService.harvest(request, run.ppid, run.cancellation);
            run.finish(HarvestRunStatus.COMPLETED, null, result, finishSequence.incrementAndGet());
            log.info("Harvest {} finished: {}", run.ppid, result.summary());
        } catch (Exception e) {
            log.warn("Harvest {} failed", run.ppid, e);
            run.finish(HarvestRunStatus.FAILED, e.getMessage(), null, finishSequence.incrementAndGet());
        }
        evictFinishedRuns();
    }

    // Running harvests are never evicted; only finished ones beyond the retention count.
    private synchronized void evictFinishedRuns() {
        List<Run> finished = runs.values().stream()
            .filter(Run::isFinished)
            .sorted(Comparator.comparingLong(Run::finishedSequence))
            .toList();
        int excess = finished.size() - retention;
        for (int i = 0; i < excess; i++) {
            Run evicted = finished.get(i);
            runs.remove(evicted.ppid);
            log.debug("Evicted finished harvest {} from the run registry", evicted.ppid);
        }
    }

    private Run find(String ppid) {
        Run run = ppid == null ? null : runs.get(ppid);
        if (run == null) {
            throw new HarvestRunNotFoundException(ppid);
        }
        return run;
    }

    private static final class Run {
        private final String ppid;
        private final String serviceUrl;
        private final Instant submittedAt;
        private final HarvestCancellation cancellation = new HarvestCancellation();
        private volatile String state = HarvestRunStatus.RUNNING;
        private volatile String error;
        private volatile HarvestResult result;
        private volatile long finishedSequence;

        private Run(String ppid, String serviceUrl, Instant submittedAt) {
            this.ppid = ppid;
            this.serviceUrl = serviceUrl;
            this.submittedAt = submittedAt;
        }

        private synchronized void finish(String state, String error, HarvestResult result, long sequence) {
            this.error = error;
            this.result = result;
            this.finishedSequence = sequence;
            this.state = state;
        }

        private boolean isFinished() {
            return !HarvestRunStatus.RUNNING.equals(state);
        }

        private long finishedSequence() {
            return finishedSequence;
        }

        private synchronized HarvestRunStatus status() {
            return new HarvestRunStatus(ppid, serviceUrl, state, submittedAt, cancellation.isCancelled(), error, result);
        }
    }
}
