package com.kats.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for transport-level retries (ledger HTTP calls, push reconnects).
 * The sync jobs themselves never retry; a failed run is simply re-triggered later.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 20;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid delay bounds: base=" + baseDelayMs + " max=" + maxDelayMs);
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Delay before the retry that follows the given zero-based attempt:
     * min(base * 2^attempt, max), then ±jitter.
     */
    public Duration delay(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), MAX_SHIFT));
        return Duration.ofMillis(jitter(Math.min(exponential, maxDelayMs)));
    }

    /** True while another attempt is allowed after {@code attemptsSoFar} failed attempts. */
    public boolean canRetry(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * Default: 1s base, 30s ceiling, ±20% jitter, 5 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 30_000L, 0.2, 5);
    }
}
