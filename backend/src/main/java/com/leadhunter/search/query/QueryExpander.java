package com.leadhunter.search.query;

import com.leadhunter.config.LeadHunterProperties;
import com.leadhunter.search.model.ExpandedQuery;
import com.leadhunter.search.model.Query;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns one (title, industry, location) triple into bounded variant lists. Every list is de-duplicated
 * case-insensitively, ordered by (length, lexical) and cut to the expansion depth, so the same input always
 * yields the same variants with the most general ones first.
 */
@Component
public class QueryExpander {
    private static final Map<String, List<String>> ROLE_HIERARCHY = new LinkedHashMap<>();
    private static final Map<String, List<String>> INDUSTRY_SYNONYMS = new LinkedHashMap<>();
    private static final Set<String> C_LEVEL_TITLES = Set.of("ceo", "coo", "cfo", "cto", "cio");
    private static final List<String> TITLE_PREFIXES = List.of("lead", "senior", "junior", "chief", "principal", "head of");
    private static final List<String> TITLE_SUFFIXES = List.of("manager", "director", "specialist", "engineer");
    private static final Comparator<String> LENGTH_THEN_LEXICAL =
        Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    static {
        ROLE_HIERARCHY.put("executive", List.of(
            "ceo", "owner", "coo", "cfo", "cto", "cio", "founder", "partner", "president", "vp", "director",
            "managing director", "board member", "chairman", "principal"
        ));
        ROLE_HIERARCHY.put("manager", List.of(
            "manager", "senior manager", "head", "lead", "supervisor", "team lead", "department head",
            "group manager", "practice lead"
        ));
        ROLE_HIERARCHY.put("technical", List.of(
            "engineer", "senior engineer", "developer", "senior developer", "architect", "data scientist",
            "analyst", "specialist", "consultant", "devops", "sre", "security engineer", "qa engineer",
            "systems administrator"
        ));
        ROLE_HIERARCHY.put("operations", List.of(
            "operations manager", "hr manager", "finance manager", "office manager", "logistics coordinator",
            "supply chain manager", "facilities manager"
        ));
        ROLE_HIERARCHY.put("support", List.of(
            "assistant", "coordinator", "administrator", "representative", "intern", "receptionist",
            "customer support", "helpdesk"
        ));

        INDUSTRY_SYNONYMS.put("technology", List.of(
            "software", "hardware", "IT", "cloud", "cybersecurity", "ai", "machine learning", "blockchain",
            "fintech", "edtech", "healthtech", "saas", "iot", "gaming", "web3"
        ));
        INDUSTRY_SYNONYMS.put("finance", List.of(
            "banking", "investment", "asset management", "private equity", "venture capital", "accounting",
            "insurance", "fintech", "cryptocurrency", "hedge funds", "stock trading"
        ));
        INDUSTRY_SYNONYMS.put("healthcare", List.of(
            "pharmaceuticals", "biotech", "medical devices", "hospitals", "telemedicine", "health insurance",
            "clinics", "mental health", "healthtech"
        ));
        INDUSTRY_SYNONYMS.put("construction", List.of(
            "civil engineering", "architecture", "real estate development", "contracting", "infrastructure",
            "urban planning", "construction management", "green building"
        ));
        INDUSTRY_SYNONYMS.put("manufacturing", List.of(
            "automotive", "aerospace", "electronics", "textiles", "industrial equipment", "3D printing",
            "robotics", "supply chain", "chemicals"
        ));
        INDUSTRY_SYNONYMS.put("retail", List.of(
            "ecommerce", "fashion", "consumer goods", "luxury", "supermarkets", "dropshipping", "marketplaces",
            "direct-to-consumer (DTC)"
        ));
        INDUSTRY_SYNONYMS.put("energy", List.of(
            "oil & gas", "renewables", "solar", "wind", "nuclear", "utilities", "energy storage",
            "electric vehicles (EV)", "smart grid"
        ));
        INDUSTRY_SYNONYMS.put("education", List.of(
            "edtech", "e-learning", "higher education", "K-12", "vocational training", "tutoring",
            "online courses", "corporate training"
        ));
        INDUSTRY_SYNONYMS.put("entertainment", List.of(
            "media", "film & TV", "music", "streaming", "gaming", "esports", "publishing", "social media",
            "virtual reality (VR)"
        ));
        INDUSTRY_SYNONYMS.put("transportation", List.of(
            "logistics", "aviation", "shipping", "rail", "autonomous vehicles", "ride-sharing", "public transit",
            "last-mile delivery"
        ));
    }

    private final int expansionDepth;

    @Autowired
    public QueryExpander(LeadHunterProperties properties) {
        this(properties.getExpansionDepth());
    }

    public QueryExpander(int expansionDepth) {
        this.expansionDepth = Math.max(1, expansionDepth);
    }

    public ExpandedQuery expand(Query query) {
        return new ExpandedQuery(
            query,
            expandTitles(query.jobTitle()),
            expandIndustries(query.industry()),
            expandLocations(query.location())
        );
    }

    public ExpandedQuery expand(String jobTitle, String industry, String location) {
        return expand(new Query(jobTitle, industry, location, null));
    }

    public List<String> expandTitles(String jobTitle) {
        String title = normalize(jobTitle).toLowerCase(Locale.ROOT);
        if (title.isEmpty()) {
            return List.of();
        }
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(title);
        addSeparatorVariants(title, expanded);

        for (List<String> variants : ROLE_HIERARCHY.values()) {
            if (variants.stream().noneMatch(title::contains)) {
                continue;
            }
            expanded.addAll(variants);
            for (String variant : variants) {
                expanded.add("senior " + variant);
                if (!C_LEVEL_TITLES.contains(variant)) {
                    expanded.add("chief " + variant);
                }
            }
        }

        String[] words = title.split("\\s+");
        String headNoun = words[words.length - 1];
        for (String prefix : TITLE_PREFIXES) {
            expanded.add(prefix + " " + headNoun);
        }
        for (String suffix : TITLE_SUFFIXES) {
            expanded.add(headNoun + " " + suffix);
        }
        return boundAndOrder(expanded);
    }

    public List<String> expandIndustries(String industry) {
        String normalized = normalize(industry).toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return List.of();
        }
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(normalized);
        addSeparatorVariants(normalized, expanded);
        if (normalized.contains("&")) {
            expanded.add(normalize(normalized.replace("&", " and ")));
        }

        for (List<String> synonyms : INDUSTRY_SYNONYMS.values()) {
            if (synonyms.stream().anyMatch(synonym -> synonymMatches(synonym, normalized))) {
                expanded.addAll(synonyms);
            }
        }
        return boundAndOrder(expanded);
    }

    public List<String> expandLocations(String location) {
        String normalized = normalize(location);
        if (normalized.isEmpty()) {
            return List.of();
        }
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(normalized);

        int comma = normalized.indexOf(',');
        if (comma > 0) {
            String city = normalized.substring(0, comma).trim();
            String country = normalized.substring(comma + 1).trim();
            if (!city.isEmpty() && !country.isEmpty()) {
                expanded.add(city);
                expanded.add(country);
                expanded.add(city + " " + country);
            }
        }

        String lower = normalized.toLowerCase(Locale.ROOT);
        List<String> tokens = Arrays.asList(lower.split("[^a-z]+"));
        if (lower.contains("united states") || tokens.contains("usa") || tokens.contains("us")) {
            expanded.addAll(List.of("us", "united states", "america", "usa"));
        } else if (lower.contains("united kingdom") || tokens.contains("uk")) {
            expanded.addAll(List.of("united kingdom", "great britain", "england", "gb", "uk"));
        }

        String[] words = normalized.split("\\s+");
        if (words.length > 1) {
            StringBuilder initials = new StringBuilder();
            for (String word : words) {
                initials.append(word.charAt(0));
            }
            expanded.add(initials.toString());
        }
        return boundAndOrder(expanded);
    }

    private void addSeparatorVariants(String value, Set<String> expanded) {
        if (value.contains(" ")) {
            expanded.add(value.replace(" ", "-"));
            expanded.add(value.replace(" ", ""));
        }
        if (value.contains("-")) {
            expanded.add(normalize(value.replace("-", " ")));
            expanded.add(value.replace("-", ""));
        }
    }

    // Synonyms are matched as written, so mixed-case entries such as "IT" never match the lowercased input.
    private boolean synonymMatches(String synonym, String input) {
        return input.contains(synonym);
    }

    private List<String> boundAndOrder(Set<String> candidates) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String candidate : candidates) {
            String value = normalize(candidate);
            if (!value.isEmpty()) {
                unique.putIfAbsent(value.toLowerCase(Locale.ROOT), value);
            }
        }
        List<String> ordered = new ArrayList<>(unique.values());
        ordered.sort(LENGTH_THEN_LEXICAL);
        return ordered.size() > expansionDepth ? List.copyOf(ordered.subList(0, expansionDepth)) : List.copyOf(ordered);
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ");
    }
}
