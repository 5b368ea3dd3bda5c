package com.leadhunter.enrichment.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.enrichment.EnrichmentException;
import com.leadhunter.search.throttle.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * JSON-over-HTTPS call shared by the enrichment services. Every attempt waits for the service's pacing slot;
 * 429 and 5xx responses and I/O errors are retried up to {@code apiRetries} times.
 */
public abstract class EnrichmentApiClient {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentApiClient.class);

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final RateLimiter pacing;
    private final String serviceName;
    private final int apiRetries;
    protected final Duration timeout;

    protected EnrichmentApiClient(
        String serviceName,
        HttpClient httpClient,
        ObjectMapper objectMapper,
        RateLimiter pacing,
        int apiRetries,
        Duration timeout
    ) {
        this.serviceName = serviceName;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.pacing = pacing;
        this.apiRetries = Math.max(0, apiRetries);
        this.timeout = timeout;
    }

    public String serviceName() {
        return serviceName;
    }

    /**
     * @return the parsed body, or empty when the service answered 404
     */
    protected Optional<JsonNode> query(HttpRequest request) throws InterruptedException {
        int maxAttempts = apiRetries + 1;
        EnrichmentException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            pacing.acquireSlot(serviceName);
            try {
                return handle(httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)));
            } catch (HttpTimeoutException e) {
                lastFailure = new EnrichmentException(
                    EnrichmentException.Kind.API_UNAVAILABLE, serviceName + " timed out", e
                );
            } catch (IOException e) {
                lastFailure = new EnrichmentException(
                    EnrichmentException.Kind.API_UNAVAILABLE, serviceName + " I/O error: " + e.getMessage(), e
                );
            } catch (RetryableStatusException e) {
                lastFailure = e.failure;
            }
            if (attempt < maxAttempts) {
                log.debug("{} attempt {} failed, retrying: {}", serviceName, attempt, lastFailure.getMessage());
            }
        }
        throw lastFailure;
    }

    protected HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", "application/json");
    }

    private Optional<JsonNode> handle(HttpResponse<String> response) throws RetryableStatusException {
        int status = response.statusCode();
        if (status == 404) {
            return Optional.empty();
        }
        if (status == 429) {
            throw new RetryableStatusException(new EnrichmentException(
                EnrichmentException.Kind.RATE_LIMITED, serviceName + " rate limited the request"
            ));
        }
        if (status >= 500) {
            throw new RetryableStatusException(new EnrichmentException(
                EnrichmentException.Kind.API_UNAVAILABLE, serviceName + " returned HTTP " + status
            ));
        }
        if (status < 200 || status >= 300) {
            throw new EnrichmentException(
                EnrichmentException.Kind.API_UNAVAILABLE, serviceName + " rejected the request with HTTP " + status
            );
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return Optional.of(objectMapper.createObjectNode());
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            throw new EnrichmentException(
                EnrichmentException.Kind.INVALID_DATA, serviceName + " returned malformed JSON", e
            );
        }
    }

    private static final class RetryableStatusException extends Exception {
        private final EnrichmentException failure;

        private RetryableStatusException(EnrichmentException failure) {
            super(failure.getMessage(), null, false, false);
            this.failure = failure;
        }
    }
}
