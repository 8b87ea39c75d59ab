package com.stealthradar.common;

import java.time.Duration;

/**
 * Bounded retry with linearly growing delay: attempt N (1-based) is followed by a wait of {@code N * baseDelay}.
 * Meant for transient per-call flakiness only; sustained outages are handled by the scan backoff.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxAttempts = maxAttempts;
    }

    public RetryPolicy(Duration baseDelay, int maxAttempts) {
        this(baseDelay != null ? baseDelay.toMillis() : 0L, maxAttempts);
    }

    /**
     * Delay in milliseconds to wait after the given failed attempt (1-based).
     */
    public long delayMs(int failedAttempt) {
        if (failedAttempt <= 0) {
            return 0L;
        }
        return baseDelayMs * failedAttempt;
    }

    public boolean hasAttemptAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 3 attempts, 1s base delay (waits 1s, then 2s).
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 3);
    }
}
