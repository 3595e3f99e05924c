package com.grale.harvester.harvest.log;

import com.grale.harvester.harvest.model.LogEntry;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Lineage store with one entry per request attempt, keyed by pid and grouped by ppid.
 *
 * <p>Safe for concurrent callers: every operation takes the log's own monitor, so
 * worker threads never lock anything themselves. Entries are created in-flight and
 * completed exactly once.
 */
public class RequestLog {
    private final Map<String, LogEntry> entries = new LinkedHashMap<>();
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public RequestLog() {
        this(Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public RequestLog(Clock clock, Supplier<String> idGenerator) {
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public String create(String ppid, Map<String, List<String>> parameters, String request) {
        synchronized (entries) {
            String pid = idGenerator.get();
            while (entries.containsKey(pid)) {
                pid = idGenerator.get();
            }
            insert(pid, ppid, parameters, request);
            return pid;
        }
    }

    public String create(String ppid, String pid, Map<String, List<String>> parameters, String request) {
        if (pid == null || pid.isBlank()) {
            return create(ppid, parameters, request);
        }
        synchronized (entries) {
            if (entries.containsKey(pid)) {
                throw new LogStateException("Log entry already exists for pid " + pid);
            }
            insert(pid, ppid, parameters, request);
            return pid;
        }
    }

    public LogEntry complete(String pid, String status, List<String> results, long elapsedMillis, long sizeBytes) {
        synchronized (entries) {
            LogEntry existing = entries.get(pid);
            if (existing == null) {
                throw new LogStateException("No log entry for pid " + pid);
            }
            if (existing.completed()) {
                throw new LogStateException("Log entry " + pid + " was already completed with status " + existing.status());
            }
            LogEntry completed = existing.complete(status, results, elapsedMillis, sizeBytes);
            entries.put(pid, completed);
            return completed;
        }
    }

    public Optional<LogEntry> find(String pid) {
        synchronized (entries) {
            return Optional.ofNullable(entries.get(pid));
        }
    }

    public List<LogEntry> snapshot() {
        synchronized (entries) {
            return new ArrayList<>(entries.values());
        }
    }

    public List<LogEntry> snapshot(String ppid) {
        List<LogEntry> out = new ArrayList<>();
        for (LogEntry entry : snapshot()) {
            if (entry.ppid() != null && entry.ppid().equals(ppid)) {
                out.add(entry);
            }
        }
        return out;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void insert(String pid, String ppid, Map<String, List<String>> parameters, String request) {
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Map<String, List<String>> safeParameters = parameters == null ? Map.of() : copyParameters(parameters);
        entries.put(pid, LogEntry.inFlight(pid, ppid, timestamp, safeParameters, request));
    }

    private Map<String, List<String>> copyParameters(Map<String, List<String>> parameters) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : parameters.entrySet()) {
            copy.put(entry.getKey(), entry.getValue() == null ? List.of() : List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
