package com.grale.harvester.harvest.api;

import com.grale.harvester.harvest.model.HarvestRequest;
import com.grale.harvester.harvest.model.OutputMode;
import com.grale.harvester.harvest.model.QueryParameters;

import java.util.List;
import java.util.Map;

public record HarvestApiRequest(
    String url,
    String where,
    List<String> outFields,
    String outSr,
    Long resultOffset,
    Long maxRecords,
    String format,
    Map<String, String> extra,
    Integer chunkSize,
    Integer maxWorkers,
    OutputMode outputMode,
    Boolean cleanup
) {
    public HarvestRequest toHarvestRequest() {
        QueryParameters query = new QueryParameters(where, outFields, outSr, resultOffset, maxRecords, format, extra);
        return new HarvestRequest(url, query, chunkSize, maxWorkers, outputMode, null, cleanup, null);
    }
}
