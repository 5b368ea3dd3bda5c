package com.leadhunter.search.throttle;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Pacing rule for one source: a fixed floor between two requests plus an optional uniform random jitter.
 */
public record RatePolicy(Duration minInterval, Duration maxJitter) {
    public static final Duration MINIMUM_DELAY = Duration.ofMillis(300);

    public RatePolicy {
        minInterval = minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval;
        maxJitter = maxJitter == null || maxJitter.isNegative() ? Duration.ZERO : maxJitter;
    }

    public static RatePolicy perMinute(int requestsPerMinute) {
        int budget = Math.max(1, requestsPerMinute);
        return new RatePolicy(Duration.ofMillis(60_000L / budget), Duration.ZERO);
    }

    public static RatePolicy delayRange(Duration min, Duration max) {
        Duration floor = min.compareTo(MINIMUM_DELAY) < 0 ? MINIMUM_DELAY : min;
        Duration ceiling = max.compareTo(floor) < 0 ? floor : max;
        return new RatePolicy(floor, ceiling.minus(floor));
    }

    public static RatePolicy fixed(Duration interval) {
        return new RatePolicy(interval, Duration.ZERO);
    }

    public Duration nextInterval() {
        long jitterMs = maxJitter.toMillis();
        if (jitterMs <= 0) {
            return minInterval;
        }
        return minInterval.plusMillis(ThreadLocalRandom.current().nextLong(jitterMs + 1));
    }
}
