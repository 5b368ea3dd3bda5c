package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.enrichment.client.SocialLookupClient;
import com.leadhunter.search.model.Lead;

import java.util.Map;

public class SocialProfileStage implements EnrichmentStage {
    public static final String NAME = "social-profiles";

    private final SocialLookupClient client;

    public SocialProfileStage(SocialLookupClient client) {
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
        if (lead.getName() == null || lead.getName().isBlank()) {
            return StageOutcome.skipped(NAME, "no name");
        }
        Map<String, String> profiles = client.findProfiles(lead.getName(), lead.getCompany());
        profiles.forEach(lead.getSocialProfiles()::putIfAbsent);
        return StageOutcome.applied(NAME, profiles.size() + " profiles");
    }
}
