package com.leadhunter.search.service;

import com.leadhunter.config.LeadHunterProperties;
import com.leadhunter.search.model.LeadSearchRequest;
import com.leadhunter.search.model.LeadSearchResult;
import com.leadhunter.search.model.SourceRunStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

@Component
public class LeadCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LeadCliRunner.class);

    private final LeadHunterProperties properties;
    private final LeadPipelineService pipelineService;
    private final LeadExportService exportService;
    private final ConfigurableApplicationContext applicationContext;

    public LeadCliRunner(
        LeadHunterProperties properties,
        LeadPipelineService pipelineService,
        LeadExportService exportService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.exportService = exportService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> regions = Arrays.stream(properties.getCli().getRegions().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        LeadSearchRequest request = new LeadSearchRequest(
            properties.getCli().getJobTitle(),
            properties.getCli().getIndustry(),
            properties.getCli().getLocation(),
            properties.getLanguageCode(),
            regions
        );

        Thread interruptHook = new Thread(pipelineService::cancelAll, "lead-run-cancel");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        LeadSearchResult result;
        try {
            result = pipelineService.run(request);
        } finally {
            removeHook(interruptHook);
        }

        Path output = exportService.export(result.leads());
        log.info("Lead run completed with status {}: {} leads written to {}", result.status(), result.leads().size(), output);
        for (SourceRunStats source : result.sources()) {
            log.info(
                "Source {}: acquisitions={}, attempts={}, hits={}, failed={}, lastError={}",
                source.sourceName(),
                source.acquisitions(),
                source.attempts(),
                source.hits(),
                source.failedAcquisitions(),
                source.lastError()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }
}
