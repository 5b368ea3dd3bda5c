package com.leadhunter.search.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Working copy of a contact while it moves through enrichment. Created once per unique url, owned by a single
 * enrichment task at a time, and frozen into a {@link LeadRecord} by the aggregator.
 */
public class Lead {
    private final String url;
    private final String source;
    private final String snippet;
    private String name;
    private String title;
    private String company;
    private String location;
    private String domain;
    private final Set<String> emails = new LinkedHashSet<>();
    private final Set<String> phones = new LinkedHashSet<>();
    private final Map<String, String> socialProfiles = new LinkedHashMap<>();
    private Double score;

    public Lead(String url, String source, String name, String title, String location, String snippet) {
        this.url = url;
        this.source = source;
        this.name = name;
        this.title = title;
        this.location = location;
        this.snippet = snippet;
    }

    public Lead copy() {
        Lead copy = new Lead(url, source, name, title, location, snippet);
        copy.company = company;
        copy.domain = domain;
        copy.emails.addAll(emails);
        copy.phones.addAll(phones);
        copy.socialProfiles.putAll(socialProfiles);
        copy.score = score;
        return copy;
    }

    public LeadRecord toRecord() {
        return new LeadRecord(
            name,
            url,
            title,
            company,
            location,
            new ArrayList<>(emails),
            new ArrayList<>(phones),
            socialProfiles,
            score == null ? 0.0 : score,
            source
        );
    }

    public String getUrl() {
        return url;
    }

    public String getSource() {
        return source;
    }

    public String getSnippet() {
        return snippet;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCompany() {
        return company;
    }

    public void setCompany(String company) {
        this.company = company;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    public Set<String> getEmails() {
        return emails;
    }

    public Set<String> getPhones() {
        return phones;
    }

    public Map<String, String> getSocialProfiles() {
        return socialProfiles;
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }
}
