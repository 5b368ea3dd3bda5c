package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentException;
import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.enrichment.client.PhoneValidatorClient;
import com.leadhunter.search.model.Lead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps only numbers the validator confirms. A number the validator cannot answer for counts as unverified
 * and is dropped.
 */
public class PhoneValidationStage implements EnrichmentStage {
    public static final String NAME = "phone-validation";
    private static final Logger log = LoggerFactory.getLogger(PhoneValidationStage.class);

    private final PhoneValidatorClient client;

    public PhoneValidationStage(PhoneValidatorClient client) {
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
        if (lead.getPhones().isEmpty()) {
            return StageOutcome.skipped(NAME, "no phones");
        }
        List<String> dropped = new ArrayList<>();
        for (String phone : lead.getPhones()) {
            boolean valid;
            try {
                valid = client.isValid(phone);
            } catch (EnrichmentException e) {
                log.debug("Phone {} unverifiable: {}", phone, e.getMessage());
                valid = false;
            }
            if (!valid) {
                dropped.add(phone);
            }
        }
        dropped.forEach(lead.getPhones()::remove);
        return StageOutcome.applied(NAME, dropped.size() + " dropped");
    }
}
