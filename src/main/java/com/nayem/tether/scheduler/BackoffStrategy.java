package com.nayem.tether.scheduler;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential retry backoff with jitter.
 * <p>
 * Jitter only shortens a delay and is capped below half of it, so every delay
 * is strictly longer than the one before until the ceiling is reached. From then
 * on the delay is exactly the ceiling.
 * </p>
 */
public class BackoffStrategy {

    static final double MAX_JITTER = 0.45;

    private final double jitterPercent;

    public BackoffStrategy(double jitterPercent) {
        this.jitterPercent = Math.max(0.0, Math.min(MAX_JITTER, jitterPercent));
    }

    public double jitterPercent() {
        return jitterPercent;
    }

    /**
     * @param attempt     retry number, 0 for the first retry
     * @param baseDelayMs delay of the first retry, at least 1
     * @param maxDelayMs  ceiling
     * @return delay in milliseconds
     */
    public long calculateBackoff(int attempt, long baseDelayMs, long maxDelayMs) {
        long base = Math.max(1, baseDelayMs);
        if (base >= maxDelayMs || attempt >= Long.numberOfLeadingZeros(base) - 1) {
            return maxDelayMs;
        }
        long exponentialDelay = base << Math.max(0, attempt);
        if (exponentialDelay >= maxDelayMs) {
            return maxDelayMs;
        }
        if (jitterPercent == 0.0) {
            return exponentialDelay;
        }

        long jitterRange = (long) (exponentialDelay * jitterPercent);
        long randomPortion = ThreadLocalRandom.current().nextLong(jitterRange + 1);
        return exponentialDelay - randomPortion;
    }
}
