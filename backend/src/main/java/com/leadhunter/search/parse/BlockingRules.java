package com.leadhunter.search.parse;

import java.util.List;

/**
 * Signs that a source refused normal service: phrases matched against the page text outside
 * {@code resultContainer}, and marker selectors matched against the whole document.
 */
public record BlockingRules(List<String> phrases, List<String> markerSelectors, String resultContainer) {
    public BlockingRules {
        phrases = phrases == null ? List.of() : List.copyOf(phrases);
        markerSelectors = markerSelectors == null ? List.of() : List.copyOf(markerSelectors);
    }

    public BlockingRules(List<String> phrases, List<String> markerSelectors) {
        this(phrases, markerSelectors, null);
    }

    public static BlockingRules none() {
        return new BlockingRules(List.of(), List.of());
    }
}
