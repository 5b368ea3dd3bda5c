package com.leadhunter.search.browser;

import com.leadhunter.search.throttle.ProxyEntry;

public interface BrowserSessionFactory {
    BrowserSession open(ProxyEntry proxy, String languageCode);
}
