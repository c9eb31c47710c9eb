package com.face.attendance.matching;

import java.time.Duration;

/**
 * Exponential backoff for registry query attempts.
 *
 * @param maxAttempts      total attempts including the first, at least 1
 * @param initialBackoffMs delay before the second attempt
 * @param multiplier       growth factor between consecutive delays, at least 1.0
 * @param maxBackoffMs     cap on any single delay
 */
public record RetryPolicy(int maxAttempts, long initialBackoffMs, double multiplier, long maxBackoffMs) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException("initialBackoffMs must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("maxBackoffMs must be >= initialBackoffMs");
        }
    }

    /**
     * 3 attempts, 100ms doubling up to 2s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 100, 2.0, 2000);
    }

    /**
     * A single attempt, no retries.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 1.0, 0);
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        double delay = initialBackoffMs * Math.pow(multiplier, failedAttempt - 1);
        return Duration.ofMillis((long) Math.min(delay, maxBackoffMs));
    }
}
