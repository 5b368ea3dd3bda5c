package com.leadhunter.search.browser;

import com.leadhunter.config.LeadHunterProperties;
import com.leadhunter.search.throttle.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Randomized delays and scroll plans that make a session look operated by a person. Delays follow a normal
 * distribution centred on the middle of the range and clamped to it.
 */
public class HumanPacing {
    private static final int MIN_SCROLLS = 2;
    private static final int MAX_SCROLLS = 5;
    private static final int MIN_SCROLL_PX = 200;
    private static final int MAX_SCROLL_PX = 800;
    private static final long MIN_SCROLL_PAUSE_MS = 500;
    private static final long MAX_SCROLL_PAUSE_MS = 1500;
    private static final double SCROLL_BACK_PROBABILITY = 0.4;

    private final long beforeMinMs;
    private final long beforeMaxMs;
    private final long afterMinMs;
    private final long afterMaxMs;
    private final Sleeper sleeper;
    private final Random random;

    public HumanPacing(LeadHunterProperties.Pacing pacing, Sleeper sleeper, Random random) {
        this(pacing.getBeforeMinMs(), pacing.getBeforeMaxMs(), pacing.getAfterMinMs(), pacing.getAfterMaxMs(),
            sleeper, random);
    }

    public HumanPacing(long beforeMinMs, long beforeMaxMs, long afterMinMs, long afterMaxMs, Sleeper sleeper,
                       Random random) {
        this.beforeMinMs = beforeMinMs;
        this.beforeMaxMs = Math.max(beforeMinMs, beforeMaxMs);
        this.afterMinMs = afterMinMs;
        this.afterMaxMs = Math.max(afterMinMs, afterMaxMs);
        this.sleeper = sleeper;
        this.random = random;
    }

    public static HumanPacing none() {
        return new HumanPacing(0, 0, 0, 0, Sleeper.SYSTEM, new Random());
    }

    public void pauseBeforeNavigation() throws InterruptedException {
        sleeper.sleep(humanDelay(beforeMinMs, beforeMaxMs));
    }

    public void pauseAfterNavigation() throws InterruptedException {
        sleeper.sleep(humanDelay(afterMinMs, afterMaxMs));
    }

    public void pauseBetweenScrolls() throws InterruptedException {
        long span = MAX_SCROLL_PAUSE_MS - MIN_SCROLL_PAUSE_MS;
        sleeper.sleep(Duration.ofMillis(MIN_SCROLL_PAUSE_MS + (long) (random.nextDouble() * span)));
    }

    /**
     * Signed pixel offsets; positive scrolls down. Each downward scroll may be followed by a partial scroll back.
     */
    public List<Integer> scrollPlan() {
        int scrolls = MIN_SCROLLS + random.nextInt(MAX_SCROLLS - MIN_SCROLLS + 1);
        List<Integer> plan = new ArrayList<>();
        for (int i = 0; i < scrolls; i++) {
            int amount = MIN_SCROLL_PX + random.nextInt(MAX_SCROLL_PX - MIN_SCROLL_PX + 1);
            plan.add(amount);
            if (random.nextDouble() < SCROLL_BACK_PROBABILITY) {
                plan.add(-(amount / 2));
            }
        }
        return plan;
    }

    Duration humanDelay(long minMs, long maxMs) {
        if (maxMs <= 0) {
            return Duration.ZERO;
        }
        double mean = (minMs + maxMs) / 2.0;
        double stdDev = (maxMs - minMs) / 4.0;
        double sample = mean + random.nextGaussian() * stdDev;
        long clamped = Math.max(minMs, Math.min(maxMs, Math.round(sample)));
        return Duration.ofMillis(clamped);
    }
}
