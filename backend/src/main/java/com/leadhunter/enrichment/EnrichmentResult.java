package com.leadhunter.enrichment;

import com.leadhunter.search.model.Lead;

import java.util.List;
import java.util.Optional;

public record EnrichmentResult(Lead lead, List<StageOutcome> outcomes) {
    public EnrichmentResult {
        outcomes = List.copyOf(outcomes);
    }

    public Optional<StageOutcome> outcome(String stage) {
        return outcomes.stream().filter(outcome -> outcome.stage().equals(stage)).findFirst();
    }

    public boolean ran(String stage) {
        return outcome(stage).map(outcome -> outcome.status() == StageOutcome.Status.APPLIED).orElse(false);
    }
}
