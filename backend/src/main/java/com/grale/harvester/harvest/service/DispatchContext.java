package com.grale.harvester.harvest.service;

import com.grale.harvester.harvest.http.SessionProvider;
import com.grale.harvester.harvest.log.RequestLog;
import com.grale.harvester.harvest.sink.ResultSink;

import java.util.Map;

public record DispatchContext(
    String ppid,
    String queryUrl,
    Map<String, String> baseParameters,
    boolean convertEsriJson,
    Integer maxWorkers,
    RequestLog requestLog,
    ResultSink sink,
    SessionProvider session,
    HarvestCancellation cancellation
) {
    public HarvestCancellation cancellationOrNone() {
        return cancellation == null ? HarvestCancellation.none() : cancellation;
    }
}
