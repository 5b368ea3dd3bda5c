package com.leadhunter.search.source;

import com.leadhunter.search.parse.BlockingRules;
import com.leadhunter.search.parse.SourceSchema;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Regional search engine restricted to professional-network profile pages.
 */
public class RegionalSearchAcquirer extends AbstractSourceAcquirer {
    public static final String SOURCE_NAME = "baidu";
    static final String PROFILE_FRAGMENT = "linkedin.com/in/";
    // The engine ignores rn above this.
    static final int MAX_PAGE_SIZE = 50;

    static final BlockingRules BLOCKING_RULES = new BlockingRules(
        List.of("百度安全验证", "安全验证"),
        List.of("#captcha", ".vcode-body"),
        "#content_left"
    );

    private final int maxResults;
    private final SourceSchema schema;

    public RegionalSearchAcquirer(AcquisitionContext context, int maxResults) {
        super(context);
        this.maxResults = Math.max(1, Math.min(MAX_PAGE_SIZE, maxResults));
        this.schema = new SourceSchema(
            SOURCE_NAME,
            "#content_left",
            ".result.c-container",
            "h3 a",
            null,
            "h3 a",
            ".c-abstract",
            "https://www.baidu.com",
            PROFILE_FRAGMENT,
            null,
            BLOCKING_RULES
        );
    }

    @Override
    protected SourceSchema schema() {
        return schema;
    }

    @Override
    protected String searchUrl(SearchTerms terms, String languageCode) {
        String query = "site:" + PROFILE_FRAGMENT + " intitle:\"" + terms.title() + "\" \""
            + terms.industry() + "\" \"" + terms.location() + "\"";
        return "https://www.baidu.com/s?wd=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
            + "&rn=" + maxResults + "&ie=utf-8&oe=utf-8&cl=3&tn=baidutop10";
    }
}
