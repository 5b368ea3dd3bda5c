package com.leadhunter.search.browser;

import com.leadhunter.search.http.FetchException;
import com.leadhunter.search.http.FetchOptions;
import com.leadhunter.search.http.PageFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Session backed by plain HTTP fetches and a parsed jsoup document. No script runs, so {@link #waitFor} only
 * inspects the markup that was delivered.
 */
public class HttpBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(HttpBrowserSession.class);
    private static final Pattern SELECTOR_LIKE = Pattern.compile("^[a-z]*[#.\\[][\\w\\-\\]=\"'#.\\[]+$");

    private final PageFetcher fetcher;
    private final FetchOptions options;
    private final HumanPacing pacing;
    private String html = "";
    private Document document;
    private boolean closed;

    public HttpBrowserSession(PageFetcher fetcher, FetchOptions options, HumanPacing pacing) {
        this.fetcher = fetcher;
        this.options = options;
        this.pacing = pacing;
    }

    @Override
    public void hesitate() throws InterruptedException {
        ensureOpen();
        pacing.pauseBeforeNavigation();
    }

    @Override
    public void navigate(String url) throws FetchException, InterruptedException {
        ensureOpen();
        html = fetcher.fetch(url, options);
        document = Jsoup.parse(html, url);
        pacing.pauseAfterNavigation();
    }

    @Override
    public boolean waitFor(String selector, Duration timeout) {
        ensureOpen();
        if (document == null || selector == null || selector.isBlank()) {
            return false;
        }
        try {
            return !document.select(selector).isEmpty();
        } catch (Selector.SelectorParseException e) {
            log.debug("Invalid selector {}: {}", selector, e.getMessage());
            return false;
        }
    }

    @Override
    public String pageSource() {
        ensureOpen();
        return html;
    }

    @Override
    public boolean detectMarker(String selectorOrText) {
        ensureOpen();
        if (document == null || selectorOrText == null || selectorOrText.isBlank()) {
            return false;
        }
        if (SELECTOR_LIKE.matcher(selectorOrText).matches()) {
            return waitFor(selectorOrText, Duration.ZERO);
        }
        return document.text().toLowerCase(Locale.ROOT).contains(selectorOrText.toLowerCase(Locale.ROOT));
    }

    @Override
    public void simulateHumanActivity() throws InterruptedException {
        ensureOpen();
        for (int offset : pacing.scrollPlan()) {
            log.trace("Scroll {}px", offset);
            pacing.pauseBetweenScrolls();
        }
    }

    @Override
    public void close() {
        closed = true;
        document = null;
        html = "";
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Browser session already closed");
        }
    }
}
