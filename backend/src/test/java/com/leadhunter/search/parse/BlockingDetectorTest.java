package com.leadhunter.search.parse;

import com.leadhunter.search.browser.BrowserSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlockingDetectorTest {
    private static final BlockingRules RULES = new BlockingRules(
        List.of("unusual traffic from your computer network", "security check"),
        List.of("#captcha-form")
    );

    private final BlockingDetector detector = new BlockingDetector();

    @Mock
    private BrowserSession session;

    @Test
    void markerSelectorWins() {
        String html = "<html><body><form id=\"captcha-form\"></form><p>Security check</p></body></html>";

        assertThat(detector.detect(html, RULES)).contains("#captcha-form");
    }

    @Test
    void phraseMatchesTitleOrTextIgnoringCase() {
        assertThat(detector.detect("<html><head><title>Security Check</title></head><body></body></html>", RULES))
            .contains("security check");
        assertThat(detector.detect("<p>Our systems have detected Unusual Traffic from your computer network.</p>", RULES))
            .contains("unusual traffic from your computer network");
    }

    @Test
    void ordinaryPageIsNotBlocked() {
        assertThat(detector.detect("<div id=\"search\"><div class=\"g\">CTO Berlin</div></div>", RULES)).isEmpty();
        assertThat(detector.detect("", RULES)).isEmpty();
    }

    @Test
    void sessionDetectionChecksMarkersThenPhrases() {
        when(session.detectMarker(anyString())).thenReturn(false);
        when(session.pageSource()).thenReturn("<html><body><p>Security check</p></body></html>");

        assertThat(detector.detect(session, RULES)).contains("security check");
    }

    @Test
    void phrasesInsideTheResultListingDoNotCountAsBlocking() {
        BlockingRules rules = new BlockingRules(List.of("verification", "restricted"), List.of(), ".results");
        String listing = "<html><head><title>People search</title></head><body>"
            + "<div class=\"results\"><div class=\"item\">Jane Doe, Verification Engineer</div>"
            + "<div class=\"item\">Max Muster, Export Control (restricted parties)</div></div></body></html>";
        String interstitial = "<html><head><title>Security Verification</title></head><body>"
            + "<p>Please complete this verification to continue</p></body></html>";

        assertThat(detector.detect(listing, rules)).isEmpty();
        assertThat(detector.detect(interstitial, rules)).contains("verification");
    }

    @Test
    void sessionPhraseCheckAlsoSkipsTheResultListing() {
        BlockingRules rules = new BlockingRules(List.of("verification"), List.of("#captcha"), ".results");
        when(session.detectMarker("#captcha")).thenReturn(false);
        when(session.pageSource())
            .thenReturn("<div class=\"results\"><p>Verification Engineer at Acme</p></div>");

        assertThat(detector.detect(session, rules)).isEmpty();
    }
}
