package com.grale.harvester.harvest.http;

public record RequestSpec(
    String url,
    String acceptHeader
) {
    public static RequestSpec json(String url) {
        return new RequestSpec(url, "application/json");
    }
}
