package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentStage;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.search.model.Lead;

import java.util.List;
import java.util.Locale;

public class ScoringStage implements EnrichmentStage {
    public static final String NAME = "scoring";

    static final double BASE_SCORE = 0.5;
    static final double FULL_NAME_BONUS = 0.2;
    static final double SENIOR_ROLE_BONUS = 0.2;
    static final double OWNER_ROLE_BONUS = 0.15;
    private static final List<String> SENIOR_KEYWORDS = List.of("manager", "director", "vp", "ceo");
    private static final List<String> OWNER_KEYWORDS = List.of("founder", "owner", "principal");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome apply(Lead lead) {
        double score = score(lead.getName(), lead.getTitle());
        lead.setScore(score);
        return StageOutcome.applied(NAME, String.valueOf(score));
    }

    public static double score(String name, String title) {
        double score = BASE_SCORE;
        if (name != null && name.trim().split("\\s+").length >= 2) {
            score += FULL_NAME_BONUS;
        }
        String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        if (SENIOR_KEYWORDS.stream().anyMatch(lowerTitle::contains)) {
            score += SENIOR_ROLE_BONUS;
        } else if (OWNER_KEYWORDS.stream().anyMatch(lowerTitle::contains)) {
            score += OWNER_ROLE_BONUS;
        }
        // round away binary noise so 0.5 + 0.2 + 0.2 reads as 0.9
        return Math.max(0.0, Math.min(1.0, Math.round(score * 100.0) / 100.0));
    }
}
