package com.leadhunter.search.service;

import java.time.Duration;

/**
 * @param maxAttempts total acquisition attempts per source and region, first try included
 */
public record GeneratorSettings(int maxAttempts, Duration retryDelay, int maxResults, String defaultLanguageCode) {
    public GeneratorSettings {
        maxAttempts = Math.max(1, maxAttempts);
        retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
        maxResults = Math.max(1, maxResults);
        defaultLanguageCode = defaultLanguageCode == null || defaultLanguageCode.isBlank() ? "en" : defaultLanguageCode;
    }
}
