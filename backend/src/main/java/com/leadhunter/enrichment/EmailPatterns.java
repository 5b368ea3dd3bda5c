package com.leadhunter.enrichment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class EmailPatterns {
    private static final Pattern EMAIL_SHAPE = Pattern.compile("^[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+$");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");

    private EmailPatterns() {}

    public static boolean isValid(String email) {
        if (email == null || !EMAIL_SHAPE.matcher(email).matches() || email.contains("..")) {
            return false;
        }
        int at = email.indexOf('@');
        String local = email.substring(0, at);
        String host = email.substring(at + 1);
        return !local.startsWith(".") && !local.endsWith(".") && !host.endsWith(".") && !host.endsWith("-");
    }

    /**
     * Candidates in the order first.last, flast, first_last, firstl, first. Names with fewer than two usable tokens
     * yield none.
     */
    public static List<String> candidates(String fullName, String domain) {
        if (fullName == null || domain == null || domain.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : fullName.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            String token = NON_ALPHANUMERIC.matcher(raw).replaceAll("");
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        if (tokens.size() < 2) {
            return List.of();
        }
        String first = tokens.get(0);
        String last = tokens.get(tokens.size() - 1);
        String host = domain.trim().toLowerCase(Locale.ROOT);

        Set<String> out = new LinkedHashSet<>();
        for (String local : Arrays.asList(
            first + "." + last,
            first.charAt(0) + last,
            first + "_" + last,
            first + last.charAt(0),
            first
        )) {
            String candidate = local + "@" + host;
            if (isValid(candidate)) {
                out.add(candidate);
            }
        }
        return List.copyOf(out);
    }
}
