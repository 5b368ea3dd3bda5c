package com.leadhunter.search.parse;

import com.leadhunter.search.browser.BrowserSession;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
public class BlockingDetector {

    /**
     * @return the first rule that matched, if any
     */
    public Optional<String> detect(String markup, BlockingRules rules) {
        if (markup == null || markup.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(markup);
        for (String marker : rules.markerSelectors()) {
            if (!document.select(marker).isEmpty()) {
                return Optional.of(marker);
            }
        }
        return matchPhrase(document, rules);
    }

    public Optional<String> detect(BrowserSession session, BlockingRules rules) {
        for (String marker : rules.markerSelectors()) {
            if (session.detectMarker(marker)) {
                return Optional.of(marker);
            }
        }
        String markup = session.pageSource();
        if (markup == null || markup.isBlank()) {
            return Optional.empty();
        }
        return matchPhrase(Jsoup.parse(markup), rules);
    }

    // Result listings can mention any phrase ("Verification Engineer"), so their text is left out.
    private Optional<String> matchPhrase(Document document, BlockingRules rules) {
        if (rules.resultContainer() != null && !rules.resultContainer().isBlank()) {
            document.select(rules.resultContainer()).remove();
        }
        String text = (document.title() + " " + document.text()).toLowerCase(Locale.ROOT);
        for (String phrase : rules.phrases()) {
            if (text.contains(phrase.toLowerCase(Locale.ROOT))) {
                return Optional.of(phrase);
            }
        }
        return Optional.empty();
    }
}
