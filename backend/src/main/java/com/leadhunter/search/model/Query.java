package com.leadhunter.search.model;

public record Query(
    String jobTitle,
    String industry,
    String location,
    String languageCode
) {
    public Query {
        jobTitle = jobTitle == null ? "" : jobTitle.trim();
        industry = industry == null ? "" : industry.trim();
        location = location == null ? "" : location.trim();
        languageCode = languageCode == null || languageCode.isBlank() ? "en" : languageCode.trim();
    }

    public Query withLocation(String newLocation) {
        return new Query(jobTitle, industry, newLocation, languageCode);
    }
}
