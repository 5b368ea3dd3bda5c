package com.leadhunter.search.throttle;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    @Test
    void consecutiveSlotsRespectTheMinimumInterval() throws Exception {
        ManualClock clock = new ManualClock(Instant.parse("2026-01-01T00:00:00Z"));
        List<Duration> sleeps = new ArrayList<>();
        Sleeper sleeper = duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        };
        RateLimiter limiter = new RateLimiter(RatePolicy.fixed(Duration.ZERO), clock, sleeper)
            .register("linkedin", RatePolicy.perMinute(5));

        limiter.acquireSlot("linkedin");
        Instant first = limiter.lastRequestTime("linkedin");
        clock.advance(Duration.ofSeconds(3));
        limiter.acquireSlot("linkedin");
        Instant second = limiter.lastRequestTime("linkedin");

        assertThat(sleeps).containsExactly(Duration.ofSeconds(9));
        assertThat(Duration.between(first, second)).isGreaterThanOrEqualTo(Duration.ofSeconds(12));
    }

    @Test
    void noWaitOnceTheIntervalHasPassed() throws Exception {
        ManualClock clock = new ManualClock(Instant.parse("2026-01-01T00:00:00Z"));
        List<Duration> sleeps = new ArrayList<>();
        RateLimiter limiter = new RateLimiter(RatePolicy.fixed(Duration.ofSeconds(12)), clock, sleeps::add);

        limiter.acquireSlot("google");
        clock.advance(Duration.ofSeconds(13));
        limiter.acquireSlot("google");

        assertThat(sleeps).isEmpty();
    }

    @Test
    void sourcesArePacedIndependently() throws Exception {
        ManualClock clock = new ManualClock(Instant.parse("2026-01-01T00:00:00Z"));
        List<Duration> sleeps = new ArrayList<>();
        RateLimiter limiter = new RateLimiter(RatePolicy.fixed(Duration.ofSeconds(12)), clock, sleeps::add);

        limiter.acquireSlot("google");
        limiter.acquireSlot("baidu");
        limiter.acquireSlot("linkedin");

        assertThat(sleeps).isEmpty();
        assertThat(limiter.lastRequestTime("unknown")).isNull();
    }

    @Test
    void concurrentCallersOfOneSourceAreSerialized() throws Exception {
        RateLimiter limiter = new RateLimiter(RatePolicy.fixed(Duration.ofMillis(60)));
        ExecutorService executor = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    limiter.acquireSlot("google");
                    return null;
                }));
            }
            long began = System.nanoTime();
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began);

            assertThat(elapsedMs).isGreaterThanOrEqualTo(110);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void delayRangeIsFlooredAndJitterStaysWithinRange() {
        RatePolicy policy = RatePolicy.delayRange(Duration.ofMillis(100), Duration.ofMillis(900));

        assertThat(policy.minInterval()).isEqualTo(RatePolicy.MINIMUM_DELAY);
        for (int i = 0; i < 50; i++) {
            assertThat(policy.nextInterval()).isBetween(Duration.ofMillis(300), Duration.ofMillis(900));
        }
    }

    @Test
    void perMinuteBudgetBecomesInterval() {
        assertThat(RatePolicy.perMinute(5).nextInterval()).isEqualTo(Duration.ofSeconds(12));
    }
}
