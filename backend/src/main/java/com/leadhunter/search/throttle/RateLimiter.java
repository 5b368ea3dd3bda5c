package com.leadhunter.search.throttle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-source request pacing shared by every acquisition of a run. Callers of the same source queue on a fair
 * lock, so none of them can skip the interval; different sources never wait on each other.
 */
public class RateLimiter {
    private final Map<String, RatePolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, RateState> states = new ConcurrentHashMap<>();
    private final RatePolicy defaultPolicy;
    private final Clock clock;
    private final Sleeper sleeper;

    public RateLimiter(RatePolicy defaultPolicy) {
        this(defaultPolicy, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimiter(RatePolicy defaultPolicy, Clock clock, Sleeper sleeper) {
        this.defaultPolicy = defaultPolicy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public RateLimiter register(String source, RatePolicy policy) {
        policies.put(source, policy);
        return this;
    }

    public RatePolicy policyFor(String source) {
        return policies.getOrDefault(source, defaultPolicy);
    }

    /**
     * Blocks until the source's interval since its previous granted slot has elapsed, then records the grant.
     */
    public void acquireSlot(String source) throws InterruptedException {
        RateState state = states.computeIfAbsent(source, ignored -> new RateState());
        state.lock.lockInterruptibly();
        try {
            Instant now = clock.instant();
            if (state.lastRequestTime != null) {
                Instant allowedAt = state.lastRequestTime.plus(policyFor(source).nextInterval());
                if (allowedAt.isAfter(now)) {
                    sleeper.sleep(Duration.between(now, allowedAt));
                }
            }
            state.lastRequestTime = clock.instant();
        } finally {
            state.lock.unlock();
        }
    }

    public Instant lastRequestTime(String source) {
        RateState state = states.get(source);
        return state == null ? null : state.lastRequestTime;
    }

    private static final class RateState {
        private final ReentrantLock lock = new ReentrantLock(true);
        private volatile Instant lastRequestTime;
    }
}
