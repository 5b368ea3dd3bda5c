package com.leadhunter.search.model;

public record SourceRunStats(
    String sourceName,
    int acquisitions,
    int attempts,
    int hits,
    int failedAcquisitions,
    String lastError
) {}
