package com.leadhunter.search.parse;

import com.leadhunter.search.model.RawHit;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps result markup to raw hits using a {@link SourceSchema}. A result missing its link or title is skipped
 * on its own; the rest of the page is still parsed.
 */
@Component
public class SearchResultParser {
    private static final Logger log = LoggerFactory.getLogger(SearchResultParser.class);

    private final Clock clock;

    public SearchResultParser() {
        this(Clock.systemUTC());
    }

    public SearchResultParser(Clock clock) {
        this.clock = clock;
    }

    public List<RawHit> parse(String markup, SourceSchema schema) {
        return parseDetailed(markup, schema).hits();
    }

    public ParseResult parseDetailed(String markup, SourceSchema schema) {
        if (markup == null || markup.isBlank()) {
            return new ParseResult(List.of(), false, 0);
        }
        Document document = Jsoup.parse(markup, schema.baseUrl() == null ? "" : schema.baseUrl());
        List<Element> results = document.select(schema.resultSelector());
        boolean containerFound = schema.containerSelector() == null
            ? !results.isEmpty()
            : !document.select(schema.containerSelector()).isEmpty();

        Instant now = clock.instant();
        Set<String> seenUrls = new LinkedHashSet<>();
        List<RawHit> hits = new ArrayList<>();
        int skipped = 0;
        for (Element result : results) {
            RawHit hit = toHit(result, schema, now);
            if (hit == null) {
                skipped++;
                continue;
            }
            // nested result selectors can match the same entry twice
            if (seenUrls.add(hit.url())) {
                hits.add(hit);
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} incomplete {} results", skipped, schema.sourceName());
        }
        return new ParseResult(hits, containerFound, skipped);
    }

    private RawHit toHit(Element result, SourceSchema schema, Instant now) {
        Element link = result.selectFirst(schema.linkSelector());
        if (link == null) {
            return null;
        }
        String href = link.attr("abs:href");
        if (href.isBlank()) {
            href = link.attr("href");
        }
        String url = schema.urlNormalizer().apply(href.trim());
        if (url == null || url.isBlank() || !url.startsWith("http")) {
            return null;
        }
        if (schema.requiredUrlFragment() != null && !url.contains(schema.requiredUrlFragment())) {
            return null;
        }

        String name = null;
        if (schema.nameSelector() != null) {
            name = text(result, schema.nameSelector());
            if (name == null) {
                return null;
            }
        }
        String title = text(result, schema.titleSelector());
        if (title == null) {
            return null;
        }
        String snippet = schema.snippetSelector() == null ? null : text(result, schema.snippetSelector());
        return new RawHit(schema.sourceName(), url, name, title, snippet, now);
    }

    private static String text(Element scope, String selector) {
        Element element = scope.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String value = element.text().trim();
        return value.isEmpty() ? null : value;
    }
}
