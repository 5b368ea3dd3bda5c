package com.leadhunter.enrichment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.search.throttle.RateLimiter;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

public class CompanyDataClient extends EnrichmentApiClient {
    public static final String SERVICE = "company-data";

    private final String endpoint;
    private final String apiKey;

    public CompanyDataClient(String endpoint, String apiKey, HttpClient httpClient, ObjectMapper objectMapper,
                             RateLimiter pacing, int apiRetries, Duration timeout) {
        super(SERVICE, httpClient, objectMapper, pacing, apiRetries, timeout);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    public Optional<String> findCompanyName(String domain) throws InterruptedException {
        URI uri = URI.create(endpoint + "?domain=" + URLEncoder.encode(domain, StandardCharsets.UTF_8));
        Optional<JsonNode> body = query(request(uri).header("Authorization", "Bearer " + apiKey).GET().build());
        return body
            .map(node -> node.path("name").asText("").trim())
            .filter(name -> !name.isEmpty());
    }
}
