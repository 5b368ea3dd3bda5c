package com.leadhunter.search.source;

import com.leadhunter.search.browser.BrowserSessionFactory;
import com.leadhunter.search.http.PageFetcher;
import com.leadhunter.search.parse.BlockingDetector;
import com.leadhunter.search.parse.SearchResultParser;
import com.leadhunter.search.throttle.ProxyPool;
import com.leadhunter.search.throttle.RateLimiter;

import java.time.Duration;
import java.util.concurrent.Semaphore;

/**
 * Collaborators shared by every acquirer of one generator. {@code scrapingApi} is null when no scraping-API key
 * is configured; {@code browserPermits} caps concurrently open browser sessions across all sources.
 */
public record AcquisitionContext(
    RateLimiter rateLimiter,
    ProxyPool proxyPool,
    PageFetcher directFetcher,
    PageFetcher scrapingApi,
    BrowserSessionFactory browserSessionFactory,
    Semaphore browserPermits,
    SearchResultParser parser,
    BlockingDetector blockingDetector,
    Duration timeout,
    int maxQueriesPerSource
) {
    public boolean hasScrapingApi() {
        return scrapingApi != null;
    }
}
