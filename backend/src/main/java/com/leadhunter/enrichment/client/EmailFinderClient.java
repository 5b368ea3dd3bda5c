package com.leadhunter.enrichment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.search.throttle.RateLimiter;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Domain search against the email-finder service (Hunter-compatible {@code data.emails[].value}).
 */
public class EmailFinderClient extends EnrichmentApiClient {
    public static final String SERVICE = "email-finder";

    private final String endpoint;
    private final String apiKey;

    public EmailFinderClient(String endpoint, String apiKey, HttpClient httpClient, ObjectMapper objectMapper,
                             RateLimiter pacing, int apiRetries, Duration timeout) {
        super(SERVICE, httpClient, objectMapper, pacing, apiRetries, timeout);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    public DomainSearch searchDomain(String domain) throws InterruptedException {
        URI uri = URI.create(endpoint + "?domain=" + URLEncoder.encode(domain, StandardCharsets.UTF_8)
            + "&api_key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        Optional<JsonNode> body = query(request(uri).GET().build());
        if (body.isEmpty()) {
            return new DomainSearch(List.of(), null);
        }
        JsonNode data = body.get().path("data");
        List<String> emails = new ArrayList<>();
        for (JsonNode entry : data.path("emails")) {
            String value = entry.path("value").asText("").trim();
            if (!value.isEmpty()) {
                emails.add(value.toLowerCase(Locale.ROOT));
            }
        }
        String organization = data.path("organization").asText("").trim();
        return new DomainSearch(emails, organization.isEmpty() ? null : organization);
    }

    public record DomainSearch(List<String> emails, String organization) {
        public DomainSearch {
            emails = List.copyOf(emails);
        }
    }
}
