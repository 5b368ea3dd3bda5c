package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentException;
import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.search.model.Lead;

import java.util.Locale;

/**
 * Guesses the company domain as the alphanumeric company name plus ".com". No DNS lookup.
 */
public class DomainDerivationStage implements EnrichmentStage {
    public static final String NAME = "domain-derivation";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome apply(Lead lead) {
        if (lead.getDomain() != null && !lead.getDomain().isBlank()) {
            return StageOutcome.skipped(NAME, "domain already known");
        }
        if (lead.getCompany() == null || lead.getCompany().isBlank()) {
            return StageOutcome.skipped(NAME, "no company");
        }
        String stem = lead.getCompany().replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
        if (stem.isEmpty()) {
            throw new EnrichmentException(
                EnrichmentException.Kind.INVALID_DATA, "company name has no usable characters: " + lead.getCompany()
            );
        }
        lead.setDomain(stem + ".com");
        return StageOutcome.applied(NAME, lead.getDomain());
    }
}
