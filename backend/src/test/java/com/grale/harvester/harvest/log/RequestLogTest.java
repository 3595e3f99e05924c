package com.grale.harvester.harvest.log;

import com.grale.harvester.harvest.model.LogEntry;
import com.grale.harvester.harvest.model.LogEntryView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestLogTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:30:45.789Z"), ZoneOffset.UTC);

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void createsInFlightEntryAndCompletesItOnce() {
        RequestLog log = new RequestLog(CLOCK, () -> "pid-1");
        String pid = log.create("ppid-1", Map.of("where", List.of("1=1")), "https://example.com/query?where=1%3D1");

        LogEntry inFlight = log.find(pid).orElseThrow();
        assertThat(inFlight.status()).isEqualTo(LogEntry.IN_FLIGHT);
        assertThat(inFlight.completed()).isFalse();
        assertThat(inFlight.utcTimestamp()).isEqualTo(Instant.parse("2024-05-01T12:30:45Z"));

        LogEntry done = log.complete(pid, "Success", List.of("Size: 10(B), Time :0.25(s)"), 250, 10);
        assertThat(done.graleId()).isEqualTo("ppid-1_pid-1");
        assertThat(done.isSuccess()).isTrue();

        assertThatThrownBy(() -> log.complete(pid, "Timeout", List.of(), 0, 0))
            .isInstanceOf(LogStateException.class)
            .hasMessageContaining("already completed");
        assertThat(log.find(pid).orElseThrow().status()).isEqualTo("Success");
    }

    @Test
    void completingUnknownPidFails() {
        RequestLog log = new RequestLog();
        assertThatThrownBy(() -> log.complete("missing", "Success", List.of(), 0, 0))
            .isInstanceOf(LogStateException.class);
    }

    @Test
    void duplicateExplicitPidIsRejected() {
        RequestLog log = new RequestLog();
        log.create("ppid", "chunk-1", Map.of(), "u");
        assertThatThrownBy(() -> log.create("ppid", "chunk-1", Map.of(), "u"))
            .isInstanceOf(LogStateException.class);
    }

    @Test
    void generatedPidsSkipCollisions() {
        List<String> sequence = new ArrayList<>(List.of("a", "a", "b"));
        RequestLog log = new RequestLog(CLOCK, () -> sequence.remove(0));
        assertThat(log.create("p", Map.of(), "u")).isEqualTo("a");
        assertThat(log.create("p", Map.of(), "u")).isEqualTo("b");
    }

    @Test
    void snapshotIsACopyFilteredByParent() {
        RequestLog log = new RequestLog();
        log.create("first", Map.of(), "u1");
        log.create("first", Map.of(), "u2");
        log.create("second", Map.of(), "u3");

        List<LogEntry> snapshot = log.snapshot();
        snapshot.clear();

        assertThat(log.size()).isEqualTo(3);
        assertThat(log.snapshot("first")).extracting(LogEntry::request).containsExactly("u1", "u2");
        assertThat(log.snapshot("missing")).isEmpty();
    }

    @Test
    void parametersCannotBeChangedThroughTheEntry() {
        RequestLog log = new RequestLog();
        String pid = log.create("p", new HashMap<>(Map.of("f", List.of("json"))), "u");
        Map<String, List<String>> parameters = log.find(pid).orElseThrow().parameters();
        assertThatThrownBy(() -> parameters.put("x", List.of())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void viewUsesExternalFieldFormats() {
        RequestLog log = new RequestLog(CLOCK, () -> "pid");
        log.create("ppid", Map.of(), "u");
        LogEntryView view = log.complete("pid", "Success", List.of("ok"), 1234, 5678).toView();

        assertThat(view.graleUuid()).isEqualTo("ppid_pid");
        assertThat(view.utcTimestamp()).isEqualTo("2024-05-01T12:30:45Z");
        assertThat(view.elapsedTime()).isEqualTo("1234(ms)");
        assertThat(view.size()).isEqualTo("5678(B)");
    }

    @Test
    void concurrentCreateAndCompleteKeepEveryEntry() {
        RequestLog log = new RequestLog();
        executor = Executors.newFixedThreadPool(16);
        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            int index = i;
            futures.add(CompletableFuture.supplyAsync(() -> {
                String pid = log.create("shared", Map.of("i", List.of(Integer.toString(index))), "u" + index);
                log.complete(pid, "Success", List.of(), index, index);
                return pid;
            }, executor));
        }
        Set<String> pids = new HashSet<>();
        futures.forEach(future -> pids.add(future.join()));

        assertThat(pids).hasSize(2000);
        assertThat(log.snapshot("shared")).hasSize(2000).allMatch(LogEntry::completed);
    }
}
