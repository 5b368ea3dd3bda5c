package com.leadhunter.search.source;

import com.leadhunter.search.parse.BlockingRules;
import com.leadhunter.search.parse.ResultUrls;
import com.leadhunter.search.parse.SourceSchema;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * People search on the professional network. Results carry the person's name, headline and location
 * separately, so hits arrive with a name.
 */
public class ProfessionalNetworkAcquirer extends AbstractSourceAcquirer {
    public static final String SOURCE_NAME = "linkedin";

    static final BlockingRules BLOCKING_RULES = new BlockingRules(
        List.of("security check", "captcha", "verification", "too many requests", "restricted", "blocked"),
        List.of("#captcha-internal", "form#captcha-challenge"),
        ".search-results-container"
    );

    private final String domain;
    private final SourceSchema schema;

    public ProfessionalNetworkAcquirer(AcquisitionContext context, String domain) {
        super(context);
        this.domain = domain == null || domain.isBlank() ? "www.linkedin.com" : domain.trim();
        String baseUrl = "https://" + this.domain;
        this.schema = new SourceSchema(
            SOURCE_NAME,
            ".search-results-container",
            ".entity-result",
            ".entity-result__title-text a",
            ".entity-result__title-text a",
            ".entity-result__primary-subtitle",
            ".entity-result__secondary-subtitle",
            baseUrl,
            null,
            ResultUrls::stripQuery,
            BLOCKING_RULES
        );
    }

    @Override
    protected SourceSchema schema() {
        return schema;
    }

    @Override
    protected String searchUrl(SearchTerms terms, String languageCode) {
        String keywords = (terms.title() + " " + terms.location()).trim();
        return "https://" + domain + "/search/results/people/?keywords="
            + URLEncoder.encode(keywords, StandardCharsets.UTF_8)
            + "&origin=GLOBAL_SEARCH_HEADER&sid=2*B";
    }
}
