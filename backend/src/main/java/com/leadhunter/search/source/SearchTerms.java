package com.leadhunter.search.source;

import com.leadhunter.search.model.ExpandedQuery;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One (title, industry, location) combination picked from an expanded query.
 */
public record SearchTerms(String title, String industry, String location) {

    /**
     * Combinations in title-first order so a small limit still covers several title variants for the primary
     * location and industry.
     */
    public static List<SearchTerms> combine(ExpandedQuery query, int limit) {
        List<String> titles = orFallback(query.titles(), query.query().jobTitle());
        List<String> industries = orFallback(query.industries(), query.query().industry());
        List<String> locations = orFallback(query.locations(), query.query().location());

        Set<SearchTerms> out = new LinkedHashSet<>();
        for (String location : locations) {
            for (String industry : industries) {
                for (String title : titles) {
                    if (out.size() >= limit) {
                        return new ArrayList<>(out);
                    }
                    out.add(new SearchTerms(title, industry, location));
                }
            }
        }
        return new ArrayList<>(out);
    }

    private static List<String> orFallback(List<String> variants, String original) {
        return variants.isEmpty() ? List.of(original == null ? "" : original) : variants;
    }
}
