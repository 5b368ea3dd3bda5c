package com.leadhunter.search.service;

import com.leadhunter.config.ConfigException;
import com.leadhunter.config.LeadHunterProperties;
import com.leadhunter.enrichment.LeadEnricherFactory;
import com.leadhunter.search.browser.BrowserSessionFactory;
import com.leadhunter.search.http.HttpPageFetcher;
import com.leadhunter.search.http.PageFetcher;
import com.leadhunter.search.http.ScrapingApiPageFetcher;
import com.leadhunter.search.parse.BlockingDetector;
import com.leadhunter.search.parse.SearchResultParser;
import com.leadhunter.search.query.QueryExpander;
import com.leadhunter.search.source.AcquisitionContext;
import com.leadhunter.search.source.GeneralSearchAcquirer;
import com.leadhunter.search.source.ProfessionalNetworkAcquirer;
import com.leadhunter.search.source.RegionalSearchAcquirer;
import com.leadhunter.search.source.SearchResultCache;
import com.leadhunter.search.source.SourceAcquirer;
import com.leadhunter.search.throttle.ProxyListLoader;
import com.leadhunter.search.throttle.ProxyPool;
import com.leadhunter.search.throttle.RateLimiter;
import com.leadhunter.search.throttle.RatePolicy;
import com.leadhunter.search.throttle.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

import static com.leadhunter.config.LeadHunterProperties.ApiKeys.isPresent;

/**
 * Validates the configuration once at startup and builds a fresh {@link LeadGenerator} per run, so rate state,
 * proxy health and worker pools never leak from one run into the next. Only the search result cache is shared.
 */
@Component
public class LeadGeneratorFactory {
    private static final Logger log = LoggerFactory.getLogger(LeadGeneratorFactory.class);

    private final LeadHunterProperties properties;
    private final QueryExpander queryExpander;
    private final HttpPageFetcher httpPageFetcher;
    private final BrowserSessionFactory browserSessionFactory;
    private final SearchResultParser parser;
    private final BlockingDetector blockingDetector;
    private final LeadEnricherFactory enricherFactory;
    private final LeadSeedFactory seedFactory;
    private final ResultAggregator aggregator;
    private final SearchResultCache searchResultCache;

    public LeadGeneratorFactory(
        LeadHunterProperties properties,
        QueryExpander queryExpander,
        HttpPageFetcher httpPageFetcher,
        BrowserSessionFactory browserSessionFactory,
        SearchResultParser parser,
        BlockingDetector blockingDetector,
        LeadEnricherFactory enricherFactory,
        LeadSeedFactory seedFactory,
        ResultAggregator aggregator,
        SearchResultCache searchResultCache
    ) {
        properties.validate();
        this.properties = properties;
        this.queryExpander = queryExpander;
        this.httpPageFetcher = httpPageFetcher;
        this.browserSessionFactory = browserSessionFactory;
        this.parser = parser;
        this.blockingDetector = blockingDetector;
        this.enricherFactory = enricherFactory;
        this.seedFactory = seedFactory;
        this.aggregator = aggregator;
        this.searchResultCache = searchResultCache;
    }

    public LeadGenerator create() {
        ProxyPool proxyPool = proxyPool();
        RateLimiter rateLimiter = sourceRateLimiter(properties);
        PageFetcher scrapingApi = null;
        if (isPresent(properties.getApiKeys().getScrapingApi())) {
            scrapingApi = new ScrapingApiPageFetcher(
                httpPageFetcher,
                properties.getApiUrls().getScrapingApi(),
                properties.getApiKeys().getScrapingApi(),
                proxyPool.isEnabled()
            );
        }
        AcquisitionContext context = new AcquisitionContext(
            rateLimiter,
            proxyPool,
            httpPageFetcher,
            scrapingApi,
            browserSessionFactory,
            new Semaphore(properties.getMaxConcurrentBrowserSessions(), true),
            parser,
            blockingDetector,
            Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
            properties.getMaxQueriesPerSource()
        );
        List<SourceAcquirer> acquirers = List.of(
            new ProfessionalNetworkAcquirer(context, properties.getProfessionalNetworkDomain()),
            new GeneralSearchAcquirer(context, properties.getSearchDomain(), searchResultCache),
            new RegionalSearchAcquirer(context, properties.getMaxResults())
        );
        GeneratorSettings settings = new GeneratorSettings(
            properties.getMaxRetries(),
            Duration.ofMillis(properties.getRetryDelayMs()),
            properties.getMaxResults(),
            properties.getLanguageCode()
        );
        log.info("Lead generator ready: sources={}, scrapingApi={}, proxies={}",
            acquirers.stream().map(SourceAcquirer::name).toList(), scrapingApi != null, proxyPool.size());
        return new LeadGenerator(
            queryExpander,
            acquirers,
            enricherFactory.create(),
            seedFactory,
            aggregator,
            settings,
            Executors.newFixedThreadPool(properties.getMaxConcurrentAcquisitions()),
            Executors.newFixedThreadPool(properties.getEnrichmentConcurrency()),
            Sleeper.SYSTEM,
            Clock.systemUTC()
        );
    }

    static RateLimiter sourceRateLimiter(LeadHunterProperties properties) {
        RatePolicy searchPolicy = RatePolicy.delayRange(
            Duration.ofMillis(properties.getRate().getDelayMinMs()),
            Duration.ofMillis(properties.getRate().getDelayMaxMs())
        );
        return new RateLimiter(searchPolicy).register(
            ProfessionalNetworkAcquirer.SOURCE_NAME,
            RatePolicy.perMinute(properties.getRate().getProfessionalNetworkRequestsPerMinute())
        );
    }

    private ProxyPool proxyPool() {
        if (!properties.getProxy().isEnabled()) {
            return ProxyPool.disabled();
        }
        List<String> addresses = ProxyListLoader.load(properties.getProxy().getList());
        if (addresses.isEmpty()) {
            throw new ConfigException(ConfigException.Kind.MISSING_REQUIRED_PROXY, "Proxy enabled but no proxies provided");
        }
        return new ProxyPool(true, addresses);
    }
}
