package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.enrichment.client.CompanyDataClient;
import com.leadhunter.search.model.Lead;

import java.util.Optional;

public class CompanyLookupStage implements EnrichmentStage {
    public static final String NAME = "company-lookup";

    private final CompanyDataClient client;

    public CompanyLookupStage(CompanyDataClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome apply(Lead lead) throws InterruptedException {
        if (client == null) {
            return StageOutcome.skipped(NAME, "no api key");
        }
        if (lead.getCompany() != null && !lead.getCompany().isBlank()) {
            return StageOutcome.skipped(NAME, "company known");
        }
        if (lead.getDomain() == null) {
            return StageOutcome.skipped(NAME, "no domain");
        }
        Optional<String> company = client.findCompanyName(lead.getDomain());
        if (company.isEmpty()) {
            return StageOutcome.skipped(NAME, "not found");
        }
        lead.setCompany(company.get());
        return StageOutcome.applied(NAME, company.get());
    }
}
