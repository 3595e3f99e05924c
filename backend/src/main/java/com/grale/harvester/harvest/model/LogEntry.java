package com.grale.harvester.harvest.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record LogEntry(
    String pid,
    String ppid,
    Instant utcTimestamp,
    Map<String, List<String>> parameters,
    String request,
    String status,
    List<String> results,
    long elapsedMillis,
    long sizeBytes,
    boolean completed
) {
    public static final String IN_FLIGHT = "InFlight";

    public static LogEntry inFlight(String pid, String ppid, Instant utcTimestamp, Map<String, List<String>> parameters, String request) {
        return new LogEntry(pid, ppid, utcTimestamp, parameters, request, IN_FLIGHT, List.of(), 0L, 0L, false);
    }

    public LogEntry complete(String status, List<String> results, long elapsedMillis, long sizeBytes) {
        return new LogEntry(
            pid,
            ppid,
            utcTimestamp,
            parameters,
            request,
            status,
            results == null ? List.of() : List.copyOf(results),
            elapsedMillis,
            sizeBytes,
            true
        );
    }

    public String graleId() {
        return ppid + "_" + pid;
    }

    public boolean isSuccess() {
        return completed && OutcomeStatus.SUCCESS.equals(status);
    }

    public LogEntryView toView() {
        return new LogEntryView(
            graleId(),
            ppid,
            pid,
            utcTimestamp.toString(),
            request,
            parameters,
            status,
            results,
            elapsedMillis + "(ms)",
            sizeBytes + "(B)"
        );
    }
}
