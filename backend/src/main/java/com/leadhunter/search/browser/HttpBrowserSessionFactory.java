package com.leadhunter.search.browser;

import com.leadhunter.config.LeadHunterProperties;
import com.leadhunter.search.http.FetchOptions;
import com.leadhunter.search.http.HttpPageFetcher;
import com.leadhunter.search.throttle.ProxyEntry;
import com.leadhunter.search.throttle.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Random;

@Component
public class HttpBrowserSessionFactory implements BrowserSessionFactory {
    private final HttpPageFetcher fetcher;
    private final LeadHunterProperties properties;

    public HttpBrowserSessionFactory(HttpPageFetcher fetcher, LeadHunterProperties properties) {
        this.fetcher = fetcher;
        this.properties = properties;
    }

    @Override
    public BrowserSession open(ProxyEntry proxy, String languageCode) {
        FetchOptions options = new FetchOptions(
            proxy,
            true,
            null,
            Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
            languageCode
        );
        HumanPacing pacing = new HumanPacing(properties.getPacing(), Sleeper.SYSTEM, new Random());
        return new HttpBrowserSession(fetcher, options, pacing);
    }
}
