package com.platform.resourcecontroller.lateinit.ruleset;

import java.time.Duration;

/**
 * Requeue backoff used while late-initialization is pending: exponential
 * from {@code min} by {@code multiplier}, capped at {@code max}, with a
 * bounded random jitter added below the cap.
 */
public record BackoffSettings(Duration min, Duration max, double multiplier, double jitterFactor) {
    
    public static final BackoffSettings DEFAULT =
        new BackoffSettings(Duration.ofSeconds(5), Duration.ofMinutes(5), 2.0, 0.1);
    
    public BackoffSettings {
        if (min == null || max == null) {
            throw new IllegalArgumentException("min and max backoff must be set");
        }
        if (min.isNegative() || min.isZero()) {
            throw new IllegalArgumentException("min backoff must be positive");
        }
        if (max.compareTo(min) < 0) {
            throw new IllegalArgumentException("max backoff must not be below min backoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("backoff multiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitter factor must be within [0, 1]");
        }
    }
    
    /**
     * Delay before pending attempt number {@code attempt} (1-based).
     *
     * @param randomUnit a value in [0, 1) scaling the jitter
     */
    public Duration delayFor(int attempt, double randomUnit) {
        double exponential = min.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long base = (long) Math.min(exponential, max.toMillis());
        long jitter = (long) (base * jitterFactor * randomUnit);
        return Duration.ofMillis(Math.min(base + jitter, max.toMillis()));
    }
}
