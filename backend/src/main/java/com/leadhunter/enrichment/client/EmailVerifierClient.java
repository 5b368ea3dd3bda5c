package com.leadhunter.enrichment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.leadhunter.enrichment.EnrichmentException;
import com.leadhunter.search.throttle.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Mailbox check: an address passes when its format is valid and its domain has an MX record. Service failures
 * count as a pass and are not cached.
 */
public class EmailVerifierClient extends EnrichmentApiClient {
    public static final String SERVICE = "email-verifier";
    private static final Logger log = LoggerFactory.getLogger(EmailVerifierClient.class);

    private final String endpoint;
    private final String apiKey;
    private final Cache<String, Boolean> verdicts;

    public EmailVerifierClient(String endpoint, String apiKey, HttpClient httpClient, ObjectMapper objectMapper,
                               RateLimiter pacing, int apiRetries, Duration timeout, int cacheEntries,
                               Duration cacheTtl) {
        super(SERVICE, httpClient, objectMapper, pacing, apiRetries, timeout);
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.verdicts = Caffeine.newBuilder()
            .maximumSize(cacheEntries)
            .expireAfterWrite(cacheTtl)
            .build();
    }

    public boolean verify(String email) throws InterruptedException {
        String key = email.toLowerCase(Locale.ROOT);
        Boolean cached = verdicts.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        URI uri = URI.create(endpoint + "?access_key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)
            + "&email=" + URLEncoder.encode(email, StandardCharsets.UTF_8));
        Optional<JsonNode> body;
        try {
            body = query(request(uri).GET().build());
        } catch (EnrichmentException e) {
            log.warn("Email verification unavailable for {}, keeping it ({})", email, e.getMessage());
            return true;
        }
        if (body.isEmpty() || body.get().has("error")) {
            log.warn("Email verification gave no verdict for {}, keeping it", email);
            return true;
        }
        boolean valid = body.get().path("format_valid").asBoolean(false) && body.get().path("mx_found").asBoolean(false);
        verdicts.put(key, valid);
        return valid;
    }
}
