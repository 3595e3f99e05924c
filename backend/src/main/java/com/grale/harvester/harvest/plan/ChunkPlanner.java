package com.grale.harvester.harvest.plan;

import com.grale.harvester.harvest.model.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

@Component
public class ChunkPlanner {
    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);

    private final Supplier<String> idGenerator;

    public ChunkPlanner() {
        this(() -> UUID.randomUUID().toString());
    }

    public ChunkPlanner(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public int effectivePageSize(Integer requestedPageSize, Integer maxPageSize) {
        Integer pageSize;
        if (requestedPageSize == null) {
            pageSize = maxPageSize;
        } else if (maxPageSize == null) {
            pageSize = requestedPageSize;
        } else {
            pageSize = Math.min(requestedPageSize, maxPageSize);
        }
        if (pageSize == null) {
            throw new PlanningException("No page size available: service advertises no maxRecordCount and no chunk size was requested");
        }
        if (pageSize <= 0) {
            throw new PlanningException("Page size must be positive but was " + pageSize);
        }
        return pageSize;
    }

    public List<Chunk> plan(long total, long startOffset, Integer requestedPageSize, Integer maxPageSize, String ppid) {
        if (total < 0) {
            throw new PlanningException("Total record count must not be negative but was " + total);
        }
        if (startOffset < 0) {
            throw new PlanningException("Start offset must not be negative but was " + startOffset);
        }
        int pageSize = effectivePageSize(requestedPageSize, maxPageSize);
        if (total == 0) {
            return List.of();
        }
        if (startOffset >= total) {
            log.warn("resultOffset({}) is not below the available records({}); nothing to request", startOffset, total);
            return List.of();
        }

        List<Chunk> chunks = new ArrayList<>();
        long offset = startOffset;
        while (offset < total) {
            int limit = (int) Math.min(pageSize, total - offset);
            chunks.add(new Chunk(offset, limit, ppid, idGenerator.get()));
            offset += limit;
        }
        return chunks;
    }
}
