package com.leadhunter.enrichment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.search.throttle.RateLimiter;
import com.leadhunter.search.throttle.RatePolicy;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentServiceClientsTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private final RateLimiter pacing = new RateLimiter(RatePolicy.fixed(Duration.ZERO));
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void companyLookupSendsBearerTokenAndReadsName() throws Exception {
        CompanyDataClient client = new CompanyDataClient(
            server.url("/v2/companies/find").toString(), "tok", httpClient, objectMapper, pacing, 0, Duration.ofSeconds(5)
        );
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"name\": \" Globex Corporation \"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"name\": \"\"}"));

        assertThat(client.findCompanyName("globex.com")).contains("Globex Corporation");
        assertThat(client.findCompanyName("blank.io")).isEmpty();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer tok");
        assertThat(request.getPath()).isEqualTo("/v2/companies/find?domain=globex.com");
    }

    @Test
    void socialLookupPostsNameAndCompany() throws Exception {
        SocialLookupClient client = new SocialLookupClient(
            server.url("/v3/person.enrich").toString(), "tok", httpClient, objectMapper, pacing, 0, Duration.ofSeconds(5)
        );
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
            {"socialProfiles": [
              {"type": "Twitter", "url": "https://twitter.com/janedoe"},
              {"type": "LinkedIn", "url": "https://linkedin.com/in/janedoe"},
              {"type": "twitter", "url": "https://twitter.com/other"},
              {"type": "", "url": "https://example.com"}
            ]}
            """));

        Map<String, String> profiles = client.findProfiles("Jane Doe", "Acme");

        assertThat(profiles).containsExactly(
            Map.entry("twitter", "https://twitter.com/janedoe"),
            Map.entry("linkedin", "https://linkedin.com/in/janedoe")
        );
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(payload.get("fullName").asText()).isEqualTo("Jane Doe");
        assertThat(payload.get("company").asText()).isEqualTo("Acme");
    }

    @Test
    void socialLookupWithoutMatchIsEmpty() throws Exception {
        SocialLookupClient client = new SocialLookupClient(
            server.url("/v3/person.enrich").toString(), "tok", httpClient, objectMapper, pacing, 0, Duration.ofSeconds(5)
        );
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThat(client.findProfiles("Nobody Known", null)).isEmpty();
    }

    @Test
    void phoneValidationUsesBasicAuthAndTreatsMissingAsInvalid() throws Exception {
        PhoneValidatorClient client = new PhoneValidatorClient(
            server.url("/v1/PhoneNumbers").toString(), "AC123", "token", httpClient, objectMapper, pacing, 0,
            Duration.ofSeconds(5)
        );
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"phone_number\": \"+4930123456\"}"));
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThat(client.isValid("+4930123456")).isTrue();
        assertThat(client.isValid("+000")).isFalse();

        RecordedRequest request = server.takeRequest();
        String expected = "Basic " + Base64.getEncoder().encodeToString("AC123:token".getBytes(StandardCharsets.UTF_8));
        assertThat(request.getHeader("Authorization")).isEqualTo(expected);
        assertThat(request.getPath()).isEqualTo("/v1/PhoneNumbers/%2B4930123456");
    }
}
