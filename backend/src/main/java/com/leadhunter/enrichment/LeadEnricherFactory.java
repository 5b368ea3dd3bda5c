package com.leadhunter.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadhunter.config.LeadHunterProperties;
import com.leadhunter.enrichment.client.CompanyDataClient;
import com.leadhunter.enrichment.client.EmailFinderClient;
import com.leadhunter.enrichment.client.EmailVerifierClient;
import com.leadhunter.enrichment.client.PhoneValidatorClient;
import com.leadhunter.enrichment.client.SocialLookupClient;
import com.leadhunter.enrichment.stage.CompanyLookupStage;
import com.leadhunter.enrichment.stage.DomainDerivationStage;
import com.leadhunter.enrichment.stage.EmailFinderStage;
import com.leadhunter.enrichment.stage.EmailPatternStage;
import com.leadhunter.enrichment.stage.EmailVerificationStage;
import com.leadhunter.enrichment.stage.NormalizationStage;
import com.leadhunter.enrichment.stage.PhoneValidationStage;
import com.leadhunter.enrichment.stage.ScoringStage;
import com.leadhunter.enrichment.stage.SocialProfileStage;
import com.leadhunter.search.throttle.RateLimiter;
import com.leadhunter.search.throttle.RatePolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static com.leadhunter.config.LeadHunterProperties.ApiKeys.isPresent;

/**
 * Builds the stage chain for one run. Stages whose service has no key get a null client and report themselves
 * skipped. With enrichment disabled only scoring and normalization run.
 */
@Component
public class LeadEnricherFactory {
    private final LeadHunterProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LeadEnricherFactory(
        LeadHunterProperties properties,
        @Qualifier("enrichmentHttpClient") HttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public LeadEnricher create() {
        if (!properties.isEnrichmentEnabled()) {
            return new LeadEnricher(List.of(new ScoringStage(), new NormalizationStage()));
        }
        RateLimiter pacing = servicePacing();
        LeadHunterProperties.ApiKeys keys = properties.getApiKeys();
        LeadHunterProperties.ApiUrls urls = properties.getApiUrls();
        int retries = properties.getApiRetries();
        Duration timeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());

        EmailFinderClient emailFinder = isPresent(keys.getEmailFinder())
            ? new EmailFinderClient(urls.getEmailFinder(), keys.getEmailFinder(), httpClient, objectMapper, pacing, retries, timeout)
            : null;
        EmailVerifierClient emailVerifier = isPresent(keys.getEmailVerifier())
            ? new EmailVerifierClient(urls.getEmailVerifier(), keys.getEmailVerifier(), httpClient, objectMapper, pacing,
                retries, timeout, properties.getCache().getMaxEntries(),
                Duration.ofMinutes(properties.getCache().getTtlMinutes()))
            : null;
        CompanyDataClient companyData = isPresent(keys.getCompanyData())
            ? new CompanyDataClient(urls.getCompanyData(), keys.getCompanyData(), httpClient, objectMapper, pacing, retries, timeout)
            : null;
        SocialLookupClient socialLookup = isPresent(keys.getSocialLookup())
            ? new SocialLookupClient(urls.getSocialLookup(), keys.getSocialLookup(), httpClient, objectMapper, pacing, retries, timeout)
            : null;
        PhoneValidatorClient phoneValidator = isPresent(keys.getPhoneValidatorSid()) && isPresent(keys.getPhoneValidatorToken())
            ? new PhoneValidatorClient(urls.getPhoneValidator(), keys.getPhoneValidatorSid(), keys.getPhoneValidatorToken(),
                httpClient, objectMapper, pacing, retries, timeout)
            : null;

        return new LeadEnricher(List.of(
            new DomainDerivationStage(),
            new EmailPatternStage(),
            new EmailFinderStage(emailFinder),
            new EmailVerificationStage(emailVerifier, properties.isValidateEmails()),
            new CompanyLookupStage(companyData),
            new SocialProfileStage(socialLookup),
            new PhoneValidationStage(phoneValidator),
            new ScoringStage(),
            new NormalizationStage()
        ));
    }

    static RateLimiter servicePacing() {
        return new RateLimiter(RatePolicy.fixed(Duration.ofSeconds(1)))
            .register(EmailFinderClient.SERVICE, RatePolicy.fixed(Duration.ofMillis(500)))
            .register(CompanyDataClient.SERVICE, RatePolicy.fixed(Duration.ofSeconds(1)))
            .register(SocialLookupClient.SERVICE, RatePolicy.fixed(Duration.ofSeconds(2)));
    }
}
