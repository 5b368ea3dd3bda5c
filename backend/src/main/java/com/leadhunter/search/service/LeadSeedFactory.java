package com.leadhunter.search.service;

import com.leadhunter.search.model.Lead;
import com.leadhunter.search.model.RawHit;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns merged raw hits into lead seeds: one seed per url, the first hit for a url wins.
 */
@Component
public class LeadSeedFactory {
    private static final Pattern HEADLINE_AT_COMPANY = Pattern.compile("^(.+?)\\s+(?:at|@)\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s+[-–—]\\s+");
    private static final Pattern SITE_SUFFIX = Pattern.compile("\\s*[|｜]\\s*[^|｜]*$");
    private static final Pattern PHONE_CANDIDATE = Pattern.compile("\\+?\\d[\\d\\s().-]{6,}\\d");
    private static final Pattern YEAR_RANGE = Pattern.compile("^(19|20)\\d{2}\\s*[-–]\\s*(19|20)\\d{2}$");
    private static final Set<String> NON_COMPANY_HOSTS = Set.of(
        "linkedin.com", "google.com", "baidu.com", "facebook.com", "twitter.com", "x.com", "instagram.com",
        "youtube.com", "wikipedia.org", "indeed.com", "glassdoor.com", "xing.com", "github.com"
    );

    public List<Lead> merge(List<RawHit> hits, int limit) {
        Map<String, Lead> byUrl = new LinkedHashMap<>();
        for (RawHit hit : hits) {
            if (byUrl.size() >= limit) {
                break;
            }
            if (hit.url() == null || hit.url().isBlank() || byUrl.containsKey(hit.url())) {
                continue;
            }
            byUrl.put(hit.url(), seed(hit));
        }
        return new ArrayList<>(byUrl.values());
    }

    public Lead seed(RawHit hit) {
        Lead lead;
        if (hit.name() != null) {
            lead = new Lead(hit.url(), hit.sourceName(), hit.name(), hit.title(), hit.snippet(), hit.snippet());
            Matcher headline = HEADLINE_AT_COMPANY.matcher(hit.title() == null ? "" : hit.title());
            if (headline.matches()) {
                lead.setTitle(headline.group(1).trim());
                lead.setCompany(headline.group(2).trim());
            }
        } else if (isProfileUrl(hit.url())) {
            lead = profileSeed(hit);
        } else {
            lead = new Lead(hit.url(), hit.sourceName(), null, hit.title(), null, hit.snippet());
            lead.setDomain(companyDomain(hit.url()));
        }
        lead.getPhones().addAll(extractPhones(hit.snippet()));
        return lead;
    }

    private Lead profileSeed(RawHit hit) {
        String pageTitle = hit.title() == null ? "" : SITE_SUFFIX.matcher(hit.title()).replaceFirst("").trim();
        String[] parts = TITLE_SEPARATOR.split(pageTitle);
        String name = parts.length > 0 && !parts[0].isBlank() ? parts[0].trim() : null;
        String title = parts.length > 1 ? parts[1].trim() : null;
        String company = parts.length > 2 ? parts[2].trim() : null;
        if (title != null && company == null) {
            Matcher headline = HEADLINE_AT_COMPANY.matcher(title);
            if (headline.matches()) {
                title = headline.group(1).trim();
                company = headline.group(2).trim();
            }
        }
        Lead lead = new Lead(hit.url(), hit.sourceName(), name, title, null, hit.snippet());
        lead.setCompany(company);
        return lead;
    }

    static boolean isProfileUrl(String url) {
        return url != null && url.contains("/in/");
    }

    static String companyDomain(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        for (String excluded : NON_COMPANY_HOSTS) {
            if (host.equals(excluded) || host.endsWith("." + excluded)) {
                return null;
            }
        }
        return host.contains(".") ? host : null;
    }

    static List<String> extractPhones(String text) {
        List<String> phones = new ArrayList<>();
        if (text == null) {
            return phones;
        }
        Matcher matcher = PHONE_CANDIDATE.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().trim();
            int digits = candidate.replaceAll("\\D", "").length();
            if (digits >= 8 && digits <= 15 && !YEAR_RANGE.matcher(candidate).matches()) {
                phones.add(candidate);
            }
        }
        return phones;
    }
}
