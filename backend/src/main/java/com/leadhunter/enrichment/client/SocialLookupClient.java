package com.leadhunter.enrichment.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadhunter.enrichment.EnrichmentException;
import com.leadhunter.search.throttle.RateLimiter;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class SocialLookupClient extends EnrichmentApiClient {
    public static final String SERVICE = "social-lookup";

    private final String endpoint;
    private final String apiKey;

    public SocialLookupClient(String endpoint, String apiKey, HttpClient httpClient, ObjectMapper objectMapper,
                              RateLimiter pacing, int apiRetries, Duration timeout) {
        super(SERVICE, httpClient, objectMapper, pacing, apiRetries, timeout);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    /**
     * @return platform (lowercased) to profile url
     */
    public Map<String, String> findProfiles(String fullName, String company) throws InterruptedException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("fullName", fullName);
        if (company != null && !company.isBlank()) {
            payload.put("company", company);
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EnrichmentException(EnrichmentException.Kind.INVALID_DATA, "Cannot encode social lookup", e);
        }
        HttpRequest httpRequest = request(URI.create(endpoint))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();

        Optional<JsonNode> body = query(httpRequest);
        Map<String, String> profiles = new LinkedHashMap<>();
        if (body.isEmpty()) {
            return profiles;
        }
        for (JsonNode profile : body.get().path("socialProfiles")) {
            String type = profile.path("type").asText("").trim().toLowerCase(Locale.ROOT);
            String url = profile.path("url").asText("").trim();
            if (!type.isEmpty() && !url.isEmpty()) {
                profiles.putIfAbsent(type, url);
            }
        }
        return profiles;
    }
}
