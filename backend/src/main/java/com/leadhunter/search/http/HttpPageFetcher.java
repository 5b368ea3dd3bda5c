package com.leadhunter.search.http;

import com.leadhunter.search.throttle.ProxyEntry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain HTTP fetch without JavaScript rendering. One {@link HttpClient} is kept per proxy address because the
 * JDK client binds its proxy selector at build time.
 */
@Component
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final String DIRECT = "";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Pattern CHARSET = Pattern.compile("(?i)\\bcharset=\\s*\"?([^\\s;\"]+)");

    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    @Override
    public String fetch(String url, FetchOptions options) throws FetchException, InterruptedException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw FetchException.network("Malformed url " + url, e);
        }
        Duration timeout = options.timeout() == null ? Duration.ofSeconds(30) : options.timeout();
        String language = options.languageCode() == null ? "en" : options.languageCode();
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("User-Agent", UserAgents.random())
            .header("Accept", "text/html,application/xhtml+xml")
            .header("Accept-Language", language + ";q=0.9")
            .GET()
            .build();

        HttpResponse<byte[]> response;
        try {
            response = clientFor(options.proxy()).send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw FetchException.timeout("Timed out fetching " + url, e);
        } catch (IOException e) {
            throw FetchException.network("I/O error fetching " + url + ": " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw FetchException.httpStatus(status, "HTTP " + status + " from " + url);
        }
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            return "";
        }
        String charset = charsetOf(response.headers().firstValue("Content-Type").orElse(null));
        return decode(body, charset, url);
    }

    /**
     * Decodes with the header charset when there is one, otherwise lets jsoup sniff a BOM or meta declaration
     * and fall back to UTF-8.
     */
    static String decode(byte[] body, String charset, String url) throws FetchException {
        try {
            Document document = Jsoup.parse(new ByteArrayInputStream(body), charset, url);
            document.outputSettings().prettyPrint(false);
            return document.outerHtml();
        } catch (IOException e) {
            throw FetchException.network("Could not decode body from " + url + ": " + e.getMessage(), e);
        }
    }

    static String charsetOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        Matcher matcher = CHARSET.matcher(contentType);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1).trim().toUpperCase(Locale.ROOT);
        try {
            return Charset.isSupported(name) ? name : null;
        } catch (IllegalCharsetNameException e) {
            log.debug("Ignoring charset '{}' from Content-Type {}", name, contentType);
            return null;
        }
    }

    private HttpClient clientFor(ProxyEntry proxy) {
        String key = proxy == null ? DIRECT : proxy.address();
        return clients.computeIfAbsent(key, ignored -> {
            HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .version(HttpClient.Version.HTTP_1_1);
            if (proxy != null) {
                URI proxyUri = proxy.toUri();
                int port = proxyUri.getPort() > 0 ? proxyUri.getPort() : 80;
                builder.proxy(ProxySelector.of(new InetSocketAddress(proxyUri.getHost(), port)));
            }
            return builder.build();
        });
    }
}
