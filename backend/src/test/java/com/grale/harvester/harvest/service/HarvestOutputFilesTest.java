package com.grale.harvester.harvest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grale.harvester.harvest.model.LogEntryView;
import com.grale.harvester.harvest.model.MergedOutput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HarvestOutputFilesTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HarvestOutputFiles files = new HarvestOutputFiles(objectMapper);

    @TempDir
    Path tempDir;

    @Test
    void writesWithoutOverwritingExistingFiles() throws Exception {
        MergedOutput output = output("a", "run-1");

        Path first = files.write(output, tempDir, "Parks Layer", false);
        Path second = files.write(output, tempDir, "Parks Layer", false);

        assertThat(first.getFileName().toString()).isEqualTo("parks-layer.geojson");
        assertThat(second.getFileName().toString()).isEqualTo("1_parks-layer.geojson");
        assertThat(Files.size(first)).isEqualTo(Files.size(second));
    }

    @Test
    void compressedOutputIsReadableBack() throws Exception {
        Path written = files.write(output("a", "run-1"), tempDir, "parks", true);

        assertThat(written.getFileName().toString()).isEqualTo("parks.gz");
        try (InputStream in = new GZIPInputStream(Files.newInputStream(written))) {
            JsonNode tree = objectMapper.readTree(in);
            assertThat(tree.fieldNames()).toIterable()
                .containsExactly("type", "features", "request_logging", "request_metadata");
        }
        MergedOutput read = files.read(written);
        assertThat(read.featureCount()).isEqualTo(1);
        assertThat(read.requestLogging()).extracting(LogEntryView::ppid).containsExactly("run-1");
        assertThat(read.requestLogging().get(0).parameters()).containsEntry("where", List.of("1=1"));
    }

    @Test
    void mergeConcatenatesFeaturesAndDeduplicatesMetadata() throws Exception {
        Path first = files.write(output("a", "run-1"), tempDir, "parks", false);
        Path second = files.write(output("b", "run-2"), tempDir, "parks", true);

        MergedOutput merged = files.merge(List.of(first, second));

        assertThat(merged.type()).isEqualTo(MergedOutput.FEATURE_COLLECTION);
        assertThat(merged.features()).extracting(feature -> feature.get("properties").get("NAME").asText())
            .containsExactly("a", "b");
        assertThat(merged.requestLogging()).extracting(LogEntryView::ppid).containsExactly("run-1", "run-2");
        assertThat(merged.requestMetadata()).hasSize(1);
    }

    @Test
    void refusesMissingDirectoryAndUnknownExtension() throws IOException {
        Path unknown = Files.writeString(tempDir.resolve("notes.txt"), "{}");

        assertThatThrownBy(() -> files.write(output("a", "run-1"), tempDir.resolve("missing"), "parks", false))
            .isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> files.read(unknown))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Unsupported output file type");
    }

    private MergedOutput output(String name, String ppid) {
        ObjectNode feature = objectMapper.createObjectNode();
        feature.put("type", "Feature");
        feature.putObject("properties").put("NAME", name);
        feature.putNull("geometry");
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("name", "Parks");
        metadata.put("maxRecordCount", 1000);
        LogEntryView entry = new LogEntryView(
            "uuid-" + name,
            ppid,
            "pid-" + name,
            "2024-06-01T00:00:00Z",
            "https://example.com/arcgis/rest/services/Parks/FeatureServer/0/query",
            Map.of("where", List.of("1=1")),
            "Success",
            List.of("Size: 10(B), Time :0.1(s)"),
            "0.1",
            "10"
        );
        return new MergedOutput(MergedOutput.FEATURE_COLLECTION, List.of(feature), List.of(entry), List.of(metadata));
    }
}
