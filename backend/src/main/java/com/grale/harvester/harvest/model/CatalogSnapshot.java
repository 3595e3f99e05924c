package com.grale.harvester.harvest.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record CatalogSnapshot(
    String ppid,
    String rootUrl,
    Map<String, JsonNode> services,
    Map<String, JsonNode> dataSources
) {
}
