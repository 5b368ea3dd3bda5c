package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EmailPatterns;
import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.enrichment.client.EmailFinderClient;
import com.leadhunter.search.model.Lead;

public class EmailFinderStage implements EnrichmentStage {
    public static final String NAME = "email-finder";

    private final EmailFinderClient client;

    /**
     * @param client null when no email-finder key is configured
     */
    public EmailFinderStage(EmailFinderClient client) {
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
        if (lead.getDomain() == null) {
            return StageOutcome.skipped(NAME, "no domain");
        }
        EmailFinderClient.DomainSearch result = client.searchDomain(lead.getDomain());
        int added = 0;
        for (String email : result.emails()) {
            if (EmailPatterns.isValid(email) && lead.getEmails().add(email)) {
                added++;
            }
        }
        if ((lead.getCompany() == null || lead.getCompany().isBlank()) && result.organization() != null) {
            lead.setCompany(result.organization());
        }
        return StageOutcome.applied(NAME, added + " emails added");
    }
}
