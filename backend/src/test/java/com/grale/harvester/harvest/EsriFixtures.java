package com.grale.harvester.harvest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class EsriFixtures {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private EsriFixtures() {
    }

    public static String fixture(String name) {
        try {
            return Files.readString(Path.of("src/test/resources/fixtures/" + name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String pointPage(long offset, int count) {
        ObjectNode page = MAPPER.createObjectNode();
        page.put("objectIdFieldName", "OBJECTID");
        page.put("geometryType", "esriGeometryPoint");
        ArrayNode features = page.putArray("features");
        for (long i = offset; i < offset + count; i++) {
            ObjectNode feature = features.addObject();
            ObjectNode attributes = feature.putObject("attributes");
            attributes.put("OBJECTID", i + 1);
            attributes.put("NAME", "feature-" + i);
            ObjectNode geometry = feature.putObject("geometry");
            geometry.put("x", (double) i);
            geometry.put("y", (double) -i);
        }
        return page.toString();
    }

    public static String count(long count) {
        return "{\"count\":" + count + "}";
    }

    public static String serviceError(int code, String message) {
        return "{\"error\":{\"code\":" + code + ",\"message\":\"" + message + "\",\"details\":[]}}";
    }
}
