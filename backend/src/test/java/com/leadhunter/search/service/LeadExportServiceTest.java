package com.leadhunter.search.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.search.model.LeadRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LeadExportServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void writesPrettyJsonArrayWithTimestampedName() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
        LeadExportService service = new LeadExportService(objectMapper, tempDir.resolve("out"), clock);
        LeadRecord record = new LeadRecord(
            "Jane Doe", "https://x/in/jane", "CTO", "Acme", "Berlin",
            List.of("jane.doe@acme.com"), List.of("+49301234567"), Map.of("twitter", "https://twitter.com/jane"),
            0.7, "linkedin"
        );

        Path written = service.export(List.of(record));

        assertThat(written.getFileName().toString()).isEqualTo("leads_20260301_101530.json");
        String content = Files.readString(written, StandardCharsets.UTF_8);
        assertThat(content).contains(System.lineSeparator());
        JsonNode json = objectMapper.readTree(content);
        assertThat(json.isArray()).isTrue();
        assertThat(json.get(0).get("name").asText()).isEqualTo("Jane Doe");
        assertThat(json.get(0).get("emails").get(0).asText()).isEqualTo("jane.doe@acme.com");
        assertThat(json.get(0).get("socialProfiles").get("twitter").asText()).isEqualTo("https://twitter.com/jane");
        assertThat(json.get(0).get("score").asDouble()).isEqualTo(0.7);
    }

    @Test
    void emptyResultStillWritesAnArray() throws Exception {
        LeadExportService service = new LeadExportService(new ObjectMapper(), tempDir, Clock.systemUTC());

        Path written = service.export(List.of());

        assertThat(Files.readString(written).trim()).isEqualTo("[ ]");
    }
}
