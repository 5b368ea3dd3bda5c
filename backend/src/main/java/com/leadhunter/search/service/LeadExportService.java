package com.leadhunter.search.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.config.LeadHunterProperties;
import com.leadhunter.search.model.LeadRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the final lead list as a pretty-printed UTF-8 JSON array to {@code leads_yyyyMMdd_HHmmss.json}.
 */
@Service
public class LeadExportService {
    private static final Logger log = LoggerFactory.getLogger(LeadExportService.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Path directory;
    private final Clock clock;

    @Autowired
    public LeadExportService(ObjectMapper objectMapper, LeadHunterProperties properties) {
        this(objectMapper, Path.of(properties.getOutput().getDirectory()), Clock.systemDefaultZone());
    }

    public LeadExportService(ObjectMapper objectMapper, Path directory, Clock clock) {
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.clock = clock;
    }

    public Path export(List<LeadRecord> leads) {
        Path target = directory.resolve("leads_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json");
        try {
            Files.createDirectories(directory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), leads);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write leads to " + target, e);
        }
        log.info("Saved {} leads to {}", leads.size(), target.toAbsolutePath());
        return target;
    }
}
