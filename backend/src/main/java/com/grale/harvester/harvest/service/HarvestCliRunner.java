package com.grale.harvester.harvest.service;

import com.grale.harvester.config.HarvesterProperties;
import com.grale.harvester.harvest.model.HarvestRequest;
import com.grale.harvester.harvest.model.HarvestResult;
import com.grale.harvester.harvest.model.OutputMode;
import com.grale.harvester.harvest.model.QueryParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestService harvestService;
    private final HarvestOutputFiles outputFiles;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestService harvestService,
        HarvestOutputFiles outputFiles,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.harvestService = harvestService;
        this.outputFiles = outputFiles;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        HarvesterProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        List<String> outFields = Arrays.stream(cli.getOutFields() == null ? new String[0] : cli.getOutFields().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        QueryParameters query = new QueryParameters(cli.getWhere(), outFields, null, null, null, null, null);
        OutputMode mode = cli.getOutputMode() == null ? properties.getOutputMode() : cli.getOutputMode();
        HarvestRequest request = new HarvestRequest(
            cli.getUrl(),
            query,
            cli.getChunkSize(),
            null,
            mode,
            null,
            null,
            null
        );

        HarvestResult result = harvestService.harvest(request);
        log.info("Harvest {} completed with status {}: {}", result.ppid(), result.status(), result.summary());

        if (cli.getOutDir() != null && !cli.getOutDir().isBlank()) {
            String name = result.layerName() + "_._" + result.ppid();
            Path written = outputFiles.write(result.output(), Path.of(cli.getOutDir()), name, mode == OutputMode.SPILL);
            log.info("Merged output written to {}", written);
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
