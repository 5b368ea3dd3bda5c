package com.leadhunter.search.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.leadhunter.search.model.RawHit;

import java.time.Duration;
import java.util.List;

/**
 * Search results by normalized query, shared by every run of the application. Entries are immutable hit lists;
 * they leave the cache when {@code ttl} has passed since they were written or when size eviction picks them.
 */
public class SearchResultCache {
    private final Cache<String, List<RawHit>> entries;

    public SearchResultCache(int maxEntries, Duration ttl) {
        this.entries = Caffeine.newBuilder()
            .maximumSize(Math.max(1, maxEntries))
            .expireAfterWrite(ttl)
            .build();
    }

    public List<RawHit> get(String key) {
        return entries.getIfPresent(key);
    }

    /**
     * Empty results are not kept, so a query that found nothing is tried again next time.
     */
    public void put(String key, List<RawHit> hits) {
        if (!hits.isEmpty()) {
            entries.put(key, List.copyOf(hits));
        }
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
