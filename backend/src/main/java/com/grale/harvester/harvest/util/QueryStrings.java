package com.grale.harvester.harvest.util;

import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class QueryStrings {
    public static final String BASE_URL = "base_url";

    private QueryStrings() {
    }

    public static String prepare(String baseUrl, Map<String, String> parameters) {
        String base = UriComponentsBuilder.fromHttpUrl(baseUrl).build().toUriString();
        StringBuilder url = new StringBuilder(base);
        char separator = base.indexOf('?') >= 0 ? '&' : '?';
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            url.append(separator).append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
            separator = '&';
        }
        return url.toString();
    }

    public static Map<String, List<String>> parse(String url) {
        UriComponents components = UriComponentsBuilder.fromUriString(url).build();
        Map<String, List<String>> out = new LinkedHashMap<>();
        MultiValueMap<String, String> params = components.getQueryParams();
        for (Map.Entry<String, List<String>> entry : params.entrySet()) {
            List<String> values = new ArrayList<>();
            for (String value : entry.getValue()) {
                values.add(value == null ? "" : decode(value));
            }
            out.put(decode(entry.getKey()), values);
        }
        String base = UriComponentsBuilder.fromUriString(url).replaceQuery(null).build().toUriString();
        out.put(BASE_URL, List.of(base));
        return out;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
