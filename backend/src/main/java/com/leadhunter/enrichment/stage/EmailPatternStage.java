package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EmailPatterns;
import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.search.model.Lead;

import java.util.List;

public class EmailPatternStage implements EnrichmentStage {
    public static final String NAME = "email-patterns";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome apply(Lead lead) {
        if (lead.getDomain() == null) {
            return StageOutcome.skipped(NAME, "no domain");
        }
        List<String> candidates = EmailPatterns.candidates(lead.getName(), lead.getDomain());
        if (candidates.isEmpty()) {
            return StageOutcome.skipped(NAME, "name needs at least two tokens");
        }
        lead.getEmails().addAll(candidates);
        return StageOutcome.applied(NAME, candidates.size() + " candidates");
    }
}
