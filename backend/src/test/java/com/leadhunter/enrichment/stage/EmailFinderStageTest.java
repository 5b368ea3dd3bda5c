package com.leadhunter.enrichment.stage;

import com.leadhunter.enrichment.StageOutcome;
import com.leadhunter.enrichment.client.EmailFinderClient;
import com.leadhunter.search.model.Lead;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailFinderStageTest {

    @Mock
    private EmailFinderClient client;

    @Test
    void addsValidFoundEmailsAndFillsCompany() throws Exception {
        Lead lead = new Lead("https://acme.com/team", "google", null, null, null, null);
        lead.setDomain("acme.com");
        lead.getEmails().add("info@acme.com");
        when(client.searchDomain("acme.com")).thenReturn(new EmailFinderClient.DomainSearch(
            List.of("jane@acme.com", "info@acme.com", "broken..address@acme.com"), "Acme Corp"
        ));

        StageOutcome outcome = new EmailFinderStage(client).apply(lead);

        assertThat(lead.getEmails()).containsExactly("info@acme.com", "jane@acme.com");
        assertThat(lead.getCompany()).isEqualTo("Acme Corp");
        assertThat(outcome.detail()).isEqualTo("1 emails added");
    }

    @Test
    void existingCompanyIsKept() throws Exception {
        Lead lead = new Lead("https://x", "google", null, null, null, null);
        lead.setDomain("acme.com");
        lead.setCompany("Acme");
        when(client.searchDomain("acme.com")).thenReturn(new EmailFinderClient.DomainSearch(List.of(), "Acme Corp"));

        new EmailFinderStage(client).apply(lead);

        assertThat(lead.getCompany()).isEqualTo("Acme");
    }

    @Test
    void skippedWithoutDomainOrClient() throws Exception {
        Lead lead = new Lead("https://x", "google", null, null, null, null);

        assertThat(new EmailFinderStage(client).apply(lead).status()).isEqualTo(StageOutcome.Status.SKIPPED);
        assertThat(new EmailFinderStage(null).apply(lead).detail()).isEqualTo("no api key");
        verifyNoInteractions(client);
    }
}
