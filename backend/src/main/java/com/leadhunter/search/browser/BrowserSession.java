package com.leadhunter.search.browser;

import com.leadhunter.search.http.FetchException;

import java.time.Duration;

/**
 * A stateful page session. Implementations hold one page at a time and must release their resources on
 * {@link #close()}.
 */
public interface BrowserSession extends AutoCloseable {
    /**
     * Waits the way a person hesitates before opening a page. Callers pacing requests take their slot after this
     * returns, so the request goes out right after the slot is granted.
     */
    void hesitate() throws InterruptedException;

    /**
     * Loads the page immediately; any pacing before the request is the caller's.
     */
    void navigate(String url) throws FetchException, InterruptedException;

    /**
     * @return true once an element matching {@code selector} is present, false if it did not appear in time
     */
    boolean waitFor(String selector, Duration timeout) throws InterruptedException;

    String pageSource();

    /**
     * Matches a simple CSS selector ({@code #id}, {@code .class}, {@code [attr]}, optionally tag-qualified as in
     * {@code form#captcha}) against the page, or any other string case-insensitively against the page text.
     */
    boolean detectMarker(String selectorOrText);

    void simulateHumanActivity() throws InterruptedException;

    @Override
    void close();
}
