package com.leadhunter.search.model;

import java.time.Instant;

/**
 * One unprocessed search result. {@code url} is the dedup key; {@code name} is only known for sources that
 * render it separately from the headline.
 */
public record RawHit(
    String sourceName,
    String url,
    String name,
    String title,
    String snippet,
    Instant discoveredAt
) {}
