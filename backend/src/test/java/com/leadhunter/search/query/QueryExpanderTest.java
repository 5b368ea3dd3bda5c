package com.leadhunter.search.query;

import com.leadhunter.search.model.ExpandedQuery;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryExpanderTest {
    private final QueryExpander expander = new QueryExpander(3);

    @Test
    void expansionIsDeterministicAndBounded() {
        ExpandedQuery first = expander.expand("Senior Manager", "technology", "Berlin, Germany");
        ExpandedQuery second = expander.expand("Senior Manager", "technology", "Berlin, Germany");

        assertThat(first.titles()).containsExactly("head", "lead", "manager");
        assertThat(first.industries()).containsExactly("technology");
        assertThat(first.locations()).containsExactly("BG", "Berlin", "Germany");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void industrySynonymGroupsAreUnionedAndOrderedLexicallyOnTies() {
        assertThat(expander.expandIndustries("Fintech")).containsExactly("IT", "ai", "iot");
    }

    @Test
    void synonymInsideALongerWordPullsInItsGroup() {
        assertThat(expander.expandIndustries("retail")).containsExactly("IT", "ai", "iot");
        assertThat(expander.expandIndustries("fintech-ish")).containsExactly("IT", "ai", "iot");
    }

    @Test
    void synonymsMatchCaseSensitivelyAgainstTheLowercasedInput() {
        assertThat(expander.expandIndustries("IT services"))
            .containsExactly("itservices", "it services", "it-services");
    }

    @Test
    void unitedStatesFamilyIsAddedAndDuplicatesCollapseCaseInsensitively() {
        QueryExpander wide = new QueryExpander(10);

        assertThat(wide.expandLocations("Austin, USA")).containsExactly(
            "AU", "us", "USA", "Austin", "america", "Austin USA", "Austin, USA", "united states"
        );
    }

    @Test
    void locationsThatMerelyContainCountryLettersAreNotExpanded() {
        assertThat(expander.expandLocations("Jerusalem")).containsExactly("Jerusalem");
    }

    @Test
    void unitedKingdomFamily() {
        assertThat(new QueryExpander(3).expandLocations("UK")).containsExactly("UK", "gb", "england");
    }

    @Test
    void hyphenatedTitlesGainSpacedAndJoinedForms() {
        assertThat(new QueryExpander(100).expandTitles("Co-Founder"))
            .contains("co-founder", "co founder", "cofounder", "founder", "ceo", "chief founder", "senior founder")
            .doesNotContain("chief ceo")
            .hasSizeLessThanOrEqualTo(100);
    }

    @Test
    void blankInputsYieldEmptyLists() {
        ExpandedQuery expanded = expander.expand(" ", null, "");

        assertThat(expanded.titles()).isEmpty();
        assertThat(expanded.industries()).isEmpty();
        assertThat(expanded.locations()).isEmpty();
    }
}
