package com.leadhunter.search.source;

import com.leadhunter.search.browser.BrowserSession;
import com.leadhunter.search.http.FetchException;
import com.leadhunter.search.http.FetchOptions;
import com.leadhunter.search.model.ExpandedQuery;
import com.leadhunter.search.model.RawHit;
import com.leadhunter.search.parse.ParseResult;
import com.leadhunter.search.parse.SourceSchema;
import com.leadhunter.search.throttle.ProxyEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Page retrieval shared by all sources: a rate-limiter slot before every network action, the scraping API when
 * one is configured, a paced browser session otherwise, and blocking detection on whatever came back.
 */
public abstract class AbstractSourceAcquirer implements SourceAcquirer {
    private static final Logger log = LoggerFactory.getLogger(AbstractSourceAcquirer.class);

    protected final AcquisitionContext context;
    private final Set<BrowserSession> openSessions = ConcurrentHashMap.newKeySet();

    protected AbstractSourceAcquirer(AcquisitionContext context) {
        this.context = context;
    }

    protected abstract SourceSchema schema();

    protected abstract String searchUrl(SearchTerms terms, String languageCode);

    @Override
    public String name() {
        return schema().sourceName();
    }

    @Override
    public List<RawHit> acquire(ExpandedQuery query) throws AcquisitionException, InterruptedException {
        List<SearchTerms> combinations = SearchTerms.combine(query, context.maxQueriesPerSource());
        String languageCode = query.query().languageCode();
        List<RawHit> hits = new ArrayList<>();
        AcquisitionException lastFailure = null;
        int failedPages = 0;
        for (SearchTerms terms : combinations) {
            String url = searchUrl(terms, languageCode);
            try {
                hits.addAll(acquirePage(url, languageCode));
            } catch (AcquisitionException e) {
                if (e.kind() == AcquisitionException.Kind.BLOCKED) {
                    throw e;
                }
                failedPages++;
                lastFailure = preferRetryable(lastFailure, e);
                log.debug("{} page {} failed: {}", name(), url, e.getMessage());
            }
        }
        if (lastFailure != null && failedPages == combinations.size()) {
            throw lastFailure;
        }
        log.info("{} acquired {} hits from {} pages", name(), hits.size(), combinations.size() - failedPages);
        return hits;
    }

    protected List<RawHit> acquirePage(String url, String languageCode)
        throws AcquisitionException, InterruptedException {
        if (context.hasScrapingApi()) {
            return viaScrapingApi(url, languageCode);
        }
        return viaBrowser(url, languageCode);
    }

    protected List<RawHit> viaScrapingApi(String url, String languageCode)
        throws AcquisitionException, InterruptedException {
        FetchOptions options = new FetchOptions(
            null, true, schema().readySelector(), context.timeout(), languageCode
        );
        context.rateLimiter().acquireSlot(name());
        String markup;
        try {
            markup = context.scrapingApi().fetch(url, options);
        } catch (FetchException e) {
            throw transport("scraping API", e);
        }
        return parsePage(markup);
    }

    protected List<RawHit> viaDirectFetch(String url, String languageCode)
        throws AcquisitionException, InterruptedException {
        ProxyEntry proxy = nextProxy();
        FetchOptions options = FetchOptions.plain(context.timeout(), languageCode).withProxy(proxy);
        context.rateLimiter().acquireSlot(name());
        String markup;
        try {
            markup = context.directFetcher().fetch(url, options);
        } catch (FetchException e) {
            releaseProxyOnFailure(proxy, e);
            throw transport("direct fetch", e);
        }
        return parsePage(markup);
    }

    protected List<RawHit> viaBrowser(String url, String languageCode)
        throws AcquisitionException, InterruptedException {
        context.browserPermits().acquire();
        try {
            ProxyEntry proxy = nextProxy();
            BrowserSession session = context.browserSessionFactory().open(proxy, languageCode);
            openSessions.add(session);
            try {
                session.hesitate();
                context.rateLimiter().acquireSlot(name());
                try {
                    session.navigate(url);
                } catch (FetchException e) {
                    releaseProxyOnFailure(proxy, e);
                    throw transport("browser", e);
                }
                Optional<String> blocked = context.blockingDetector().detect(session, schema().blockingRules());
                if (blocked.isPresent()) {
                    throw blocked(blocked.get());
                }
                if (!session.waitFor(schema().readySelector(), context.timeout())) {
                    log.debug("{} results did not appear at {}", name(), url);
                }
                session.simulateHumanActivity();
                return parsePage(session.pageSource());
            } finally {
                openSessions.remove(session);
                session.close();
            }
        } finally {
            context.browserPermits().release();
        }
    }

    protected List<RawHit> parsePage(String markup) throws AcquisitionException {
        Optional<String> blocked = context.blockingDetector().detect(markup, schema().blockingRules());
        if (blocked.isPresent()) {
            throw blocked(blocked.get());
        }
        ParseResult result = context.parser().parseDetailed(markup, schema());
        if (!result.containerFound() && result.hits().isEmpty()) {
            throw new AcquisitionException(
                AcquisitionException.Kind.PARSE_EMPTY, name(), name() + " returned a page without results"
            );
        }
        return result.hits();
    }

    @Override
    public void close() {
        for (BrowserSession session : openSessions) {
            session.close();
        }
        openSessions.clear();
    }

    private ProxyEntry nextProxy() throws AcquisitionException {
        if (!context.proxyPool().isEnabled()) {
            return null;
        }
        return context.proxyPool().next().orElseThrow(() -> new AcquisitionException(
            AcquisitionException.Kind.TRANSPORT, name(), "No usable proxy left for " + name()
        ));
    }

    private void releaseProxyOnFailure(ProxyEntry proxy, FetchException e) {
        if (proxy != null && e.isConnectionFailure()) {
            context.proxyPool().markFailed(proxy);
        }
    }

    private AcquisitionException blocked(String marker) {
        return new AcquisitionException(
            AcquisitionException.Kind.BLOCKED, name(), name() + " blocked the request (" + marker + ")"
        );
    }

    private AcquisitionException transport(String path, FetchException e) {
        return new AcquisitionException(
            AcquisitionException.Kind.TRANSPORT, name(), name() + " " + path + " failed: " + e.getMessage(), e
        );
    }

    private static AcquisitionException preferRetryable(AcquisitionException current, AcquisitionException next) {
        if (current == null || (!current.isRetryable() && next.isRetryable())) {
            return next;
        }
        return current;
    }
}
