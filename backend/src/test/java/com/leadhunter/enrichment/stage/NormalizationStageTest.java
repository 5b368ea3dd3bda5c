package com.leadhunter.enrichment.stage;

import com.leadhunter.search.model.Lead;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizationStageTest {

    @Test
    void capitalizesNameAndCleansContactFields() {
        Lead lead = new Lead("https://x", "google", "  jANE   doe ", null, null, null);
        lead.getEmails().add(" Jane.Doe@ACME.com");
        lead.getEmails().add("jane.doe@acme.com");
        lead.getPhones().add("+49 (30) 123-4567");
        lead.getPhones().add("030 1234 567");
        lead.getPhones().add("( )");

        new NormalizationStage().apply(lead);

        assertThat(lead.getName()).isEqualTo("Jane Doe");
        assertThat(lead.getEmails()).containsExactly("jane.doe@acme.com");
        assertThat(lead.getPhones()).containsExactly("+49301234567", "0301234567");
    }

    @Test
    void leavesMissingNameAlone() {
        Lead lead = new Lead("https://x", "google", null, null, null, null);

        new NormalizationStage().apply(lead);

        assertThat(lead.getName()).isNull();
    }
}
