package com.leadhunter.enrichment;

import com.leadhunter.search.model.Lead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the stages in order against one lead. Each stage works on a copy that is adopted only if the stage
 * completes, so a failing stage leaves every field as it was. Never throws.
 */
public class LeadEnricher {
    private static final Logger log = LoggerFactory.getLogger(LeadEnricher.class);

    private final List<EnrichmentStage> stages;

    public LeadEnricher(List<EnrichmentStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public List<String> stageNames() {
        return stages.stream().map(EnrichmentStage::name).toList();
    }

    public EnrichmentResult enrich(Lead seed) {
        Lead current = seed.copy();
        List<StageOutcome> outcomes = new ArrayList<>();
        for (EnrichmentStage stage : stages) {
            if (Thread.currentThread().isInterrupted()) {
                outcomes.add(StageOutcome.skipped(stage.name(), "cancelled"));
                continue;
            }
            Lead candidate = current.copy();
            try {
                StageOutcome outcome = stage.apply(candidate);
                current = candidate;
                outcomes.add(outcome);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(StageOutcome.skipped(stage.name(), "cancelled"));
            } catch (EnrichmentException e) {
                log.warn("Enrichment stage {} failed for {} ({}): {}", stage.name(), seed.getUrl(), e.kind(), e.getMessage());
                outcomes.add(StageOutcome.failed(stage.name(), e.kind() + ": " + e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Enrichment stage {} failed for {}: {}", stage.name(), seed.getUrl(), e.toString());
                outcomes.add(StageOutcome.failed(stage.name(), e.toString()));
            }
        }
        return new EnrichmentResult(current, outcomes);
    }
}
