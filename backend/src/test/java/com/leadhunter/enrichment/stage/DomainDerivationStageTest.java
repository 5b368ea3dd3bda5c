package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.EnrichmentException;
import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.search.model.Lead;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainDerivationStageTest {
    private final DomainDerivationStage stage = new DomainDerivationStage();

    private static Lead lead(String company, String domain) {
        Lead lead = new Lead("https://x", "linkedin", "Jane Doe", null, null, null);
        lead.setCompany(company);
        lead.setDomain(domain);
        return lead;
    }

    @Test
    void derivesDomainFromCompanyName() {
        Lead lead = lead("Acme & Sons, Inc.", null);

        StageOutcome outcome = stage.apply(lead);

        assertThat(lead.getDomain()).isEqualTo("acmesonsinc.com");
        assertThat(outcome.status()).isEqualTo(StageOutcome.Status.APPLIED);
    }

    @Test
    void knownDomainOrMissingCompanyIsSkipped() {
        Lead known = lead("Acme", "acme.io");

        assertThat(stage.apply(known).status()).isEqualTo(StageOutcome.Status.SKIPPED);
        assertThat(known.getDomain()).isEqualTo("acme.io");
        assertThat(stage.apply(lead(null, null)).status()).isEqualTo(StageOutcome.Status.SKIPPED);
    }

    @Test
    void companyWithoutUsableCharactersIsInvalidData() {
        assertThatThrownBy(() -> stage.apply(lead("株式会社", null)))
            .isInstanceOfSatisfying(EnrichmentException.class,
                e -> assertThat(e.kind()).isEqualTo(EnrichmentException.Kind.INVALID_DATA));
    }
}
