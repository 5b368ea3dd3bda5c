package com.leadhunter.search.model;

import com.leadhunter.enrichment.StageOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one run. {@code enrichmentOutcomes} maps each lead url to the outcome of every enrichment stage.
 */
public record LeadSearchResult(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int rawHits,
    List<SourceRunStats> sources,
    List<LeadRecord> leads,
    Map<String, List<StageOutcome>> enrichmentOutcomes
) {
    public static final String COMPLETED = "COMPLETED";
    public static final String COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    public static final String NO_SOURCES_REACHABLE = "NO_SOURCES_REACHABLE";
    public static final String CANCELLED = "CANCELLED";
}
