package com.grale.harvester.harvest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.model.LogEntryView;
import com.grale.harvester.harvest.model.MergedOutput;
import com.grale.harvester.harvest.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Writes merged outputs to disk and reads them back. Existing files are never
 * overwritten; a numeric prefix is added instead.
 */
@Component
public class HarvestOutputFiles {
    private static final Logger log = LoggerFactory.getLogger(HarvestOutputFiles.class);
    public static final String GEOJSON = "geojson";
    public static final String GZIP = "gz";

    private final ObjectMapper objectMapper;

    public HarvestOutputFiles(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(MergedOutput output, Path directory, String name, boolean compress) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new NoSuchFileException(String.valueOf(directory), null, "Output directory does not exist");
        }
        Path target = FileNames.nextFreePath(directory, name, compress ? GZIP : GEOJSON);
        byte[] bytes = objectMapper.writeValueAsBytes(output);
        if (compress) {
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(target, StandardOpenOption.CREATE_NEW))) {
                out.write(bytes);
            }
        } else {
            Files.write(target, bytes, StandardOpenOption.CREATE_NEW);
        }
        log.info("Wrote {} feature(s) to {}", output.featureCount(), target);
        return target;
    }

    public MergedOutput read(Path file) throws IOException {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        byte[] bytes;
        if (fileName.endsWith("." + GZIP)) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
                bytes = in.readAllBytes();
            }
        } else if (fileName.endsWith("." + GEOJSON) || fileName.endsWith(".json")) {
            bytes = Files.readAllBytes(file);
        } else {
            throw new IOException("Unsupported output file type: " + file);
        }
        JsonNode tree = objectMapper.readTree(bytes);
        return objectMapper.treeToValue(tree, MergedOutput.class);
    }

    public List<MergedOutput> readAll(List<Path> files) throws IOException {
        List<MergedOutput> outputs = new ArrayList<>();
        for (Path file : files) {
            outputs.add(read(file));
        }
        return outputs;
    }

    public MergedOutput merge(List<Path> files) throws IOException {
        List<JsonNode> features = new ArrayList<>();
        List<LogEntryView> logging = new ArrayList<>();
        List<JsonNode> metadata = new ArrayList<>();
        for (MergedOutput output : readAll(files)) {
            if (output.features() != null) {
                features.addAll(output.features());
            }
            if (output.requestLogging() != null) {
                logging.addAll(output.requestLogging());
            }
            if (output.requestMetadata() != null) {
                for (JsonNode document : output.requestMetadata()) {
                    if (document != null && !metadata.contains(document)) {
                        metadata.add(document);
                    }
                }
            }
        }
        return new MergedOutput(MergedOutput.FEATURE_COLLECTION, features, logging, metadata);
    }
}
