package com.leadhunter.search.parse;

import java.util.function.UnaryOperator;

/**
 * Selector map from one source's result markup to {@link com.leadhunter.search.model.RawHit} fields.
 * {@code containerSelector}, {@code nameSelector}, {@code snippetSelector} and {@code requiredUrlFragment} may be
 * null. When {@code nameSelector} is null the name is left for the seed factory to derive from the title.
 */
public record SourceSchema(
    String sourceName,
    String containerSelector,
    String resultSelector,
    String linkSelector,
    String nameSelector,
    String titleSelector,
    String snippetSelector,
    String baseUrl,
    String requiredUrlFragment,
    UnaryOperator<String> urlNormalizer,
    BlockingRules blockingRules
) {
    public SourceSchema {
        urlNormalizer = urlNormalizer == null ? UnaryOperator.identity() : urlNormalizer;
        blockingRules = blockingRules == null ? BlockingRules.none() : blockingRules;
    }

    /**
     * The selector that proves a result page rendered, used when waiting on a browser session.
     */
    public String readySelector() {
        return containerSelector != null ? containerSelector : resultSelector;
    }
}
