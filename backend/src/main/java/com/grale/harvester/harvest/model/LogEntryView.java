package com.grale.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({
    "grale_uuid", "ppid", "pid", "utc_timestamp", "request", "parameters",
    "status", "results", "elapsed_time", "size"
})
public record LogEntryView(
    @JsonProperty("grale_uuid") String graleUuid,
    @JsonProperty("ppid") String ppid,
    @JsonProperty("pid") String pid,
    @JsonProperty("utc_timestamp") String utcTimestamp,
    @JsonProperty("request") String request,
    @JsonProperty("parameters") Map<String, List<String>> parameters,
    @JsonProperty("status") String status,
    @JsonProperty("results") List<String> results,
    @JsonProperty("elapsed_time") String elapsedTime,
    @JsonProperty("size") String size
) {
}
