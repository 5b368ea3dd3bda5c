package com.leadhunter.search.parse;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

public final class ResultUrls {
    private ResultUrls() {}

    public static String stripQuery(String url) {
        if (url == null) {
            return null;
        }
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) {
            cut = Math.min(cut, query);
        }
        if (fragment >= 0) {
            cut = Math.min(cut, fragment);
        }
        return url.substring(0, cut);
    }

    /**
     * Unwraps search-engine redirect links of the form {@code /url?q=<target>&...} and drops tracking parameters.
     */
    public static String unwrapRedirect(String url) {
        if (url == null) {
            return null;
        }
        String target = url;
        int marker = target.indexOf("/url?q=");
        if (marker >= 0) {
            target = target.substring(marker + "/url?q=".length());
            int amp = target.indexOf('&');
            if (amp >= 0) {
                target = target.substring(0, amp);
            }
            target = URLDecoder.decode(target, StandardCharsets.UTF_8);
        }
        return stripQuery(target);
    }
}
