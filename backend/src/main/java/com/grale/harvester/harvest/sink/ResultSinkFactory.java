package com.grale.harvester.harvest.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.model.OutputMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Component
public class ResultSinkFactory {
    private final ObjectMapper objectMapper;

    public ResultSinkFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ResultSink create(OutputMode mode, Path spillDirectory, String layerName) throws IOException {
        if (mode == OutputMode.SPILL) {
            return new SpillResultSink(objectMapper, spillDirectory, layerName);
        }
        return new MemoryResultSink(objectMapper);
    }
}
