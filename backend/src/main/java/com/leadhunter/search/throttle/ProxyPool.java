package com.leadhunter.search.throttle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Round-robin proxy rotation. A proxy marked failed is never handed out again by this pool instance.
 */
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);

    private final boolean enabled;
    private final List<ProxyEntry> entries;
    private int nextIndex;

    public ProxyPool(boolean enabled, List<String> addresses) {
        this.enabled = enabled;
        List<ProxyEntry> out = new ArrayList<>();
        for (String address : new LinkedHashSet<>(addresses == null ? List.<String>of() : addresses)) {
            if (address != null && !address.isBlank()) {
                out.add(new ProxyEntry(address.trim()));
            }
        }
        this.entries = List.copyOf(out);
    }

    public static ProxyPool disabled() {
        return new ProxyPool(false, List.of());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public synchronized Optional<ProxyEntry> next() {
        if (!enabled || entries.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < entries.size(); i++) {
            ProxyEntry candidate = entries.get(nextIndex);
            nextIndex = (nextIndex + 1) % entries.size();
            if (!candidate.isFailed()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public synchronized void markFailed(ProxyEntry proxy) {
        if (proxy == null || proxy.isFailed()) {
            return;
        }
        for (ProxyEntry entry : entries) {
            if (entry == proxy || entry.address().equals(proxy.address())) {
                entry.markFailed();
                log.warn("Proxy {} marked failed ({} of {} failed)", entry.address(), failedCount(), entries.size());
                return;
            }
        }
    }

    public synchronized int failedCount() {
        int failed = 0;
        for (ProxyEntry entry : entries) {
            if (entry.isFailed()) {
                failed++;
            }
        }
        return failed;
    }

    public int size() {
        return entries.size();
    }
}
