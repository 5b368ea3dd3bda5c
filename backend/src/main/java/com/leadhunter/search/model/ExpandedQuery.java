package com.leadhunter.search.model;

import java.util.List;

/**
 * Variant sets derived from one {@link Query}. Each list is de-duplicated case-insensitively and ordered by
 * (length, lexical).
 */
public record ExpandedQuery(
    Query query,
    List<String> titles,
    List<String> industries,
    List<String> locations
) {
    public ExpandedQuery {
        titles = List.copyOf(titles);
        industries = List.copyOf(industries);
        locations = List.copyOf(locations);
    }

    public String primaryTitle() {
        return titles.isEmpty() ? query.jobTitle() : titles.get(0);
    }

    public String primaryIndustry() {
        return industries.isEmpty() ? query.industry() : industries.get(0);
    }
}
