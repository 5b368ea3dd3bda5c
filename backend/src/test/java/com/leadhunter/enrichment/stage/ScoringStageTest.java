package com.leadhunter.enrichment.stage;

import com.leadhunter.search.model.Lead;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringStageTest {

    @Test
    void fullNameAndSeniorRoleScoreHighest() {
        assertThat(ScoringStage.score("Jane Doe", "Engineering Manager")).isEqualTo(0.9);
        assertThat(ScoringStage.score("Jane Doe", "VP Marketing")).isEqualTo(0.9);
    }

    @Test
    void ownerRolesScoreBelowSeniorRoles() {
        assertThat(ScoringStage.score("Jane Doe", "Co-Founder")).isEqualTo(0.85);
        assertThat(ScoringStage.score("Jane", "Owner")).isEqualTo(0.65);
    }

    @Test
    void baseScoreWhenNothingMatches() {
        assertThat(ScoringStage.score("Jane", "Analyst")).isEqualTo(0.5);
        assertThat(ScoringStage.score(null, null)).isEqualTo(0.5);
    }

    @Test
    void applyStoresScoreOnLead() {
        Lead lead = new Lead("https://x", "google", "Jane Doe", "Sales Director", null, null);

        new ScoringStage().apply(lead);

        assertThat(lead.getScore()).isEqualTo(0.9);
    }
}
