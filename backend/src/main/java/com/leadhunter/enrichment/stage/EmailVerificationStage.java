package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.enrichment.client.EmailVerifierClient;
import com.leadhunter.search.model.Lead;

import java.util.ArrayList;
import java.util.List;

public class EmailVerificationStage implements EnrichmentStage {
    public static final String NAME = "email-verification";

    private final EmailVerifierClient client;
    private final boolean enabled;

    public EmailVerificationStage(EmailVerifierClient client, boolean enabled) {
        this.client = client;
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome apply(Lead lead) throws InterruptedException {
        if (!enabled) {
            return StageOutcome.skipped(NAME, "disabled");
        }
        if (client == null) {
            return StageOutcome.skipped(NAME, "no api key");
        }
        if (lead.getEmails().isEmpty()) {
            return StageOutcome.skipped(NAME, "no emails");
        }
        List<String> rejected = new ArrayList<>();
        for (String email : lead.getEmails()) {
            if (!client.verify(email)) {
                rejected.add(email);
            }
        }
        rejected.forEach(lead.getEmails()::remove);
        return StageOutcome.applied(NAME, rejected.size() + " rejected");
    }
}
