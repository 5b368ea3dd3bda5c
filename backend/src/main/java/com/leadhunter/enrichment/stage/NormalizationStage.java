package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.search.model.Lead;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class NormalizationStage implements EnrichmentStage {
    public static final String NAME = "normalization";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome apply(Lead lead) {
        if (lead.getName() != null) {
            lead.setName(capitalizeTokens(lead.getName()));
        }
        replaceAll(lead.getPhones(), normalizedPhones(lead.getPhones()));
        Set<String> emails = new LinkedHashSet<>();
        for (String email : lead.getEmails()) {
            emails.add(email.trim().toLowerCase(Locale.ROOT));
        }
        replaceAll(lead.getEmails(), emails);
        return StageOutcome.applied(NAME, null);
    }

    static String capitalizeTokens(String name) {
        List<String> tokens = new ArrayList<>();
        for (String token : name.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            tokens.add(token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1).toLowerCase(Locale.ROOT));
        }
        return String.join(" ", tokens);
    }

    static String normalizePhone(String phone) {
        String trimmed = phone.trim();
        String digits = trimmed.replaceAll("[^\\d]", "");
        return trimmed.startsWith("+") ? "+" + digits : digits;
    }

    private static Set<String> normalizedPhones(Set<String> phones) {
        Set<String> out = new LinkedHashSet<>();
        for (String phone : phones) {
            String normalized = normalizePhone(phone);
            if (!normalized.isEmpty() && !"+".equals(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }

    private static void replaceAll(Set<String> target, Set<String> values) {
        target.clear();
        target.addAll(values);
    }
}
