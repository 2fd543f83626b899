package io.github.drompincen.taskbridge.runtime.retry;

import java.time.Duration;

/**
 * Pacing and backoff settings for outbound calls.
 *
 * @param maxAttempts total attempts including the first one
 * @param minInterval minimum spacing between the start of two consecutive calls
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        double multiplier,
        Duration maxDelay,
        Duration minInterval
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative() || minInterval.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), Duration.ofMillis(50));
    }

    /** Delay before retry number {@code retry} (1-based), capped at {@link #maxDelay()}. */
    public Duration delayBeforeRetry(int retry) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
