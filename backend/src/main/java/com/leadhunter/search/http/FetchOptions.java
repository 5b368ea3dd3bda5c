package com.leadhunter.search.http;

import com.leadhunter.search.throttle.ProxyEntry;

import java.time.Duration;

public record FetchOptions(
    ProxyEntry proxy,
    boolean renderJs,
    String waitSelector,
    Duration timeout,
    String languageCode
) {
    public static FetchOptions plain(Duration timeout, String languageCode) {
        return new FetchOptions(null, false, null, timeout, languageCode);
    }

    public FetchOptions withProxy(ProxyEntry newProxy) {
        return new FetchOptions(newProxy, renderJs, waitSelector, timeout, languageCode);
    }
}
