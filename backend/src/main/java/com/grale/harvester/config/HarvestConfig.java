package com.grale.harvester.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.grale.harvester.harvest.http.HttpSessionProvider;
import com.grale.harvester.harvest.http.SessionProvider;
import com.grale.harvester.harvest.log.RequestLog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HarvestConfig {

    @Bean(name = "harvestRunExecutor", destroyMethod = "shutdown")
    public ExecutorService harvestRunExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionProvider sessionProvider(HarvesterProperties properties) {
        return new HttpSessionProvider(properties.toSessionSettings());
    }

    /**
     * Process-wide default lineage log, used whenever a caller does not pass its own.
     */
    @Bean
    public RequestLog requestLog(Clock clock) {
        return new RequestLog(clock, () -> UUID.randomUUID().toString());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
