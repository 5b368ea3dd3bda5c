package com.leadhunter.enrichment;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmailPatternsTest {

    @Test
    void acceptsOrdinaryAddresses() {
        assertThat(EmailPatterns.isValid("john.doe@acme.com")).isTrue();
        assertThat(EmailPatterns.isValid("j+sales@mail.acme-corp.co.uk")).isTrue();
    }

    @Test
    void rejectsMalformedAddresses() {
        assertThat(EmailPatterns.isValid("john..doe@acme.com")).isFalse();
        assertThat(EmailPatterns.isValid("no-at-sign.com")).isFalse();
        assertThat(EmailPatterns.isValid(".john@acme.com")).isFalse();
        assertThat(EmailPatterns.isValid("john.@acme.com")).isFalse();
        assertThat(EmailPatterns.isValid("john@acme.com-")).isFalse();
        assertThat(EmailPatterns.isValid(null)).isFalse();
    }

    @Test
    void candidatesFollowFixedPatternOrder() {
        assertThat(EmailPatterns.candidates("John Doe", "acme.com")).containsExactly(
            "john.doe@acme.com", "jdoe@acme.com", "john_doe@acme.com", "johnd@acme.com", "john@acme.com"
        );
    }

    @Test
    void middleNamesAndPunctuationAreIgnored() {
        assertThat(EmailPatterns.candidates("Anna-Lena M. O'Brien", "Beta.IO")).first()
            .isEqualTo("annalena.obrien@beta.io");
    }

    @Test
    void singleTokenNameOrMissingDomainYieldsNothing() {
        assertThat(EmailPatterns.candidates("Madonna", "acme.com")).isEmpty();
        assertThat(EmailPatterns.candidates("John Doe", " ")).isEmpty();
        assertThat(EmailPatterns.candidates(null, "acme.com")).isEmpty();
    }
}
