package com.leadhunter.search.source;

import com.leadhunter.search.model.ExpandedQuery;
import com.leadhunter.search.model.RawHit;
import com.leadhunter.search.parse.BlockingRules;
import com.leadhunter.search.parse.ResultUrls;
import com.leadhunter.search.parse.SourceSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * General web search. Tries the scraping API, then a direct fetch, then a browser session, stopping at the first
 * strategy that yields results. Successful acquisitions go to the application-wide {@link SearchResultCache}.
 */
public class GeneralSearchAcquirer extends AbstractSourceAcquirer {
    public static final String SOURCE_NAME = "google";
    private static final Logger log = LoggerFactory.getLogger(GeneralSearchAcquirer.class);

    static final BlockingRules BLOCKING_RULES = new BlockingRules(
        List.of("unusual traffic from your computer network", "detected unusual traffic"),
        List.of("#captcha-form", "form#captcha"),
        "#search"
    );

    private final String domain;
    private final SourceSchema schema;
    private final SearchResultCache resultCache;

    public GeneralSearchAcquirer(AcquisitionContext context, String domain, SearchResultCache resultCache) {
        super(context);
        this.domain = domain == null || domain.isBlank() ? "google.com" : domain.trim();
        this.schema = new SourceSchema(
            SOURCE_NAME,
            "#search",
            ".tF2Cxc, .g, .rc",
            "a[href]",
            null,
            "h3",
            ".VwiC3b, .IsZvec, .st, .s",
            "https://www." + this.domain,
            null,
            ResultUrls::unwrapRedirect,
            BLOCKING_RULES
        );
        this.resultCache = resultCache;
    }

    @Override
    public List<RawHit> acquire(ExpandedQuery query) throws AcquisitionException, InterruptedException {
        String key = cacheKey(query);
        List<RawHit> cached = resultCache.get(key);
        if (cached != null) {
            log.debug("Result cache hit for {}", key);
            return cached;
        }
        List<RawHit> hits = List.copyOf(super.acquire(query));
        resultCache.put(key, hits);
        return hits;
    }

    @Override
    protected List<RawHit> acquirePage(String url, String languageCode)
        throws AcquisitionException, InterruptedException {
        if (context.hasScrapingApi()) {
            try {
                List<RawHit> hits = viaScrapingApi(url, languageCode);
                if (!hits.isEmpty()) {
                    return hits;
                }
            } catch (AcquisitionException e) {
                log.debug("Scraping API strategy failed for {}: {}", url, e.getMessage());
            }
        }
        try {
            List<RawHit> hits = viaDirectFetch(url, languageCode);
            if (!hits.isEmpty()) {
                return hits;
            }
        } catch (AcquisitionException e) {
            log.debug("Direct strategy failed for {}: {}", url, e.getMessage());
        }
        return viaBrowser(url, languageCode);
    }

    @Override
    protected SourceSchema schema() {
        return schema;
    }

    @Override
    protected String searchUrl(SearchTerms terms, String languageCode) {
        String text = String.join(" ", terms.title(), terms.industry(), terms.location()).trim().replaceAll("\\s+", " ");
        return "https://www." + domain + "/search?q=" + URLEncoder.encode(text, StandardCharsets.UTF_8)
            + "&hl=" + URLEncoder.encode(languageCode, StandardCharsets.UTF_8)
            + "&num=100";
    }

    private String cacheKey(ExpandedQuery query) {
        return String.join("|",
            domain,
            query.query().jobTitle(),
            query.query().industry(),
            query.query().location(),
            query.query().languageCode()
        ).toLowerCase(Locale.ROOT);
    }
}
