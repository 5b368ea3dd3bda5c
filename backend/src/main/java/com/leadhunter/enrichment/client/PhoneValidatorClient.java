package com.leadhunter.enrichment.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.search.throttle.RateLimiter;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Phone lookup service: a number is valid when the lookup resource exists.
 */
public class PhoneValidatorClient extends EnrichmentApiClient {
    public static final String SERVICE = "phone-validator";

    private final String endpoint;
    private final String authorization;

    public PhoneValidatorClient(String endpoint, String accountSid, String authToken, HttpClient httpClient,
                                ObjectMapper objectMapper, RateLimiter pacing, int apiRetries, Duration timeout) {
        super(SERVICE, httpClient, objectMapper, pacing, apiRetries, timeout);
        this.endpoint = endpoint.endsWith("/") ? endpoint : endpoint + "/";
        String credentials = accountSid + ":" + authToken;
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isValid(String phone) throws InterruptedException {
        URI uri = URI.create(endpoint + URLEncoder.encode(phone, StandardCharsets.UTF_8));
        return query(request(uri).header("Authorization", authorization).GET().build()).isPresent();
    }
}
