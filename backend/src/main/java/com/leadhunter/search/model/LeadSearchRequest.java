package com.leadhunter.search.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record LeadSearchRequest(
    String jobTitle,
    String industry,
    String location,
    String languageCode,
    List<String> regions
) {
    public List<String> normalizedRegions() {
        if (regions == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String region : regions) {
            if (region == null) {
                continue;
            }
            String normalized = region.trim().toUpperCase(Locale.ROOT);
            if (!normalized.isEmpty() && !out.contains(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }
}
