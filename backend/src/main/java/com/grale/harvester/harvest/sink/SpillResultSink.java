package com.grale.harvester.harvest.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.model.Chunk;
import com.grale.harvester.harvest.model.ChunkResult;
import com.grale.harvester.harvest.model.LogEntry;
import com.grale.harvester.harvest.util.ByteSizes;
import com.grale.harvester.harvest.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public class SpillResultSink implements ResultSink {
    private static final Logger log = LoggerFactory.getLogger(SpillResultSink.class);
    public static final String DELIMITER = "_._";
    public static final String EXTENSION = "gz";

    private final ObjectMapper objectMapper;
    private final Path directory;
    private final boolean ownsDirectory;
    private final String layerName;
    private final Map<String, Path> artifacts = new ConcurrentHashMap<>();
    private final AtomicLong uncompressedBytes = new AtomicLong();
    private final AtomicLong compressedBytes = new AtomicLong();

    public SpillResultSink(ObjectMapper objectMapper, Path directory, String layerName) throws IOException {
        this.objectMapper = objectMapper;
        this.layerName = layerName == null || layerName.isBlank() ? "layer" : layerName;
        if (directory == null) {
            this.directory = Files.createTempDirectory("grale-");
            this.ownsDirectory = true;
        } else {
            this.ownsDirectory = !Files.exists(directory);
            this.directory = Files.createDirectories(directory);
        }
    }

    public static String artifactName(String layerName, LogEntry entry, Chunk chunk) {
        String name = String.join(
            DELIMITER,
            layerName,
            entry.utcTimestamp().truncatedTo(ChronoUnit.SECONDS).toString(),
            Long.toString(chunk.endOffset()),
            chunk.parentId(),
            chunk.ownId()
        );
        return FileNames.sanitize(name, EXTENSION);
    }

    @Override
    public ChunkResult put(Chunk chunk, LogEntry entry, JsonNode payload) throws IOException {
        Path target = directory.resolve(artifactName(layerName, entry, chunk));
        if (artifacts.putIfAbsent(chunk.ownId(), target) != null) {
            throw new IllegalStateException("Artifact already written for chunk " + chunk.ownId());
        }
        byte[] raw = objectMapper.writeValueAsBytes(payload);
        boolean created = false;
        try (OutputStream file = openArtifact(target)) {
            created = true;
            try (OutputStream out = new GZIPOutputStream(file)) {
                out.write(raw);
            }
        } catch (IOException e) {
            artifacts.remove(chunk.ownId());
            if (created) {
                discardPartial(target, e);
            }
            throw e;
        }
        uncompressedBytes.addAndGet(raw.length);
        compressedBytes.addAndGet(Files.size(target));
        return ChunkResult.spilled(chunk, entry.status(), FeaturePayloads.featureCount(payload), target);
    }

    protected OutputStream openArtifact(Path target) throws IOException {
        return Files.newOutputStream(target, StandardOpenOption.CREATE_NEW);
    }

    private void discardPartial(Path target, IOException cause) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException deleteFailure) {
            cause.addSuppressed(deleteFailure);
        }
    }

    @Override
    public byte[] read(ChunkResult result) throws IOException {
        Path artifact = result.artifact() != null ? result.artifact() : artifacts.get(result.pid());
        if (artifact == null) {
            throw new IOException("No artifact recorded for chunk " + result.pid());
        }
        try (InputStream in = new GZIPInputStream(Files.newInputStream(artifact))) {
            return in.readAllBytes();
        }
    }

    @Override
    public JsonNode load(ChunkResult result) throws IOException {
        return objectMapper.readTree(read(result));
    }

    @Override
    public void cleanup() {
        for (Path artifact : new ArrayList<>(artifacts.values())) {
            try {
                Files.deleteIfExists(artifact);
            } catch (IOException e) {
                log.warn("Could not remove spill artifact {}", artifact, e);
            }
        }
        artifacts.clear();
        if (ownsDirectory && isEmptyDirectory(directory)) {
            try {
                Files.deleteIfExists(directory);
            } catch (IOException e) {
                log.warn("Could not remove spill directory {}", directory, e);
            }
        }
    }

    @Override
    public String describeUsage() {
        return "Compressed results using gzip from " + ByteSizes.humanReadable(uncompressedBytes.get())
            + " to " + ByteSizes.humanReadable(compressedBytes.get());
    }

    public Path directory() {
        return directory;
    }

    public List<Path> artifacts() {
        return new ArrayList<>(artifacts.values());
    }

    public long uncompressedBytes() {
        return uncompressedBytes.get();
    }

    public long compressedBytes() {
        return compressedBytes.get();
    }

    private boolean isEmptyDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            return !stream.iterator().hasNext();
        } catch (IOException e) {
            log.warn("Could not inspect spill directory {}", dir, e);
            return false;
        }
    }
}
