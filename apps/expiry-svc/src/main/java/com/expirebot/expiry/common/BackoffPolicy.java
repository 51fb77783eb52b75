package com.expirebot.expiry.common;

/**
 * Capped exponential backoff for rate-limited homeserver calls.
 */
public final class BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxAttempts;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be at least baseDelayMs");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds after the given zero-based attempt.
     * Formula: baseDelay * 2^attempt, capped at maxDelay.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return baseDelayMs;
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return Math.min(exponential, maxDelayMs);
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, 32s cap, 5 attempts.
     */
    public static BackoffPolicy defaultPolicy() {
        return new BackoffPolicy(1000L, 32_000L, 5);
    }
}
