package com.leadhunter.search.model;

import java.util.List;
import java.util.Map;

public record LeadRecord(
    String name,
    String url,
    String title,
    String company,
    String location,
    List<String> emails,
    List<String> phones,
    Map<String, String> socialProfiles,
    double score,
    String source
) {
    public LeadRecord {
        emails = List.copyOf(emails);
        phones = List.copyOf(phones);
        socialProfiles = Map.copyOf(socialProfiles);
    }
}
