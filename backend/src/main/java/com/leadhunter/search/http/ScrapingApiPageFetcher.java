package com.leadhunter.search.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routes a fetch through a third-party scraping API that renders the target and rotates its own proxies.
 */
public class ScrapingApiPageFetcher implements PageFetcher {
    private static final String RENDER_WAIT_MS = "5000";

    private final PageFetcher transport;
    private final String endpoint;
    private final String apiKey;
    private final boolean premiumProxy;

    public ScrapingApiPageFetcher(PageFetcher transport, String endpoint, String apiKey, boolean premiumProxy) {
        this.transport = transport;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.premiumProxy = premiumProxy;
    }

    @Override
    public String fetch(String url, FetchOptions options) throws FetchException, InterruptedException {
        Duration timeout = options.timeout() == null ? Duration.ofSeconds(30) : options.timeout();
        FetchOptions apiOptions = new FetchOptions(null, false, null, timeout, options.languageCode());
        return transport.fetch(buildApiUrl(url, options), apiOptions);
    }

    String buildApiUrl(String targetUrl, FetchOptions options) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("api_key", apiKey);
        params.put("url", targetUrl);
        params.put("render_js", String.valueOf(options.renderJs()));
        if (options.waitSelector() != null && !options.waitSelector().isBlank()) {
            params.put("wait_for", options.waitSelector());
        }
        params.put("wait", RENDER_WAIT_MS);
        params.put("premium_proxy", String.valueOf(premiumProxy));

        StringBuilder out = new StringBuilder(endpoint);
        out.append(endpoint.contains("?") ? '&' : '?');
        boolean first = true;
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (!first) {
                out.append('&');
            }
            first = false;
            out.append(param.getKey()).append('=').append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
        }
        return out.toString();
    }
}
