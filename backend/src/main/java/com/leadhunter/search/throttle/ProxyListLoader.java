package com.leadhunter.search.throttle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

public final class ProxyListLoader {
    private ProxyListLoader() {}

    /**
     * Reads proxies from a file (one per line) when {@code source} names an existing file, otherwise treats it
     * as a comma-separated list.
     */
    public static List<String> load(String source) {
        if (source == null || source.isBlank()) {
            return List.of();
        }
        Path path = asPath(source.trim());
        if (path != null && Files.isRegularFile(path)) {
            try {
                return Files.readAllLines(path, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read proxy list " + path, e);
            }
        }
        return Arrays.stream(source.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static Path asPath(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
