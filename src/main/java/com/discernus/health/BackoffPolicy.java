package com.discernus.health;

import java.time.Duration;

/**
 * Exponential backoff with proportional jitter. {@code random} is a value in
 * [0, 1) supplied by the caller so the delay stays a pure function.
 */
public record BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterRatio) {
    public static final BackoffPolicy DEFAULT = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2);

    public BackoffPolicy {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Backoff needs 0 <= baseDelay <= maxDelay");
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
        }
    }

    public Duration delay(int attempt, double random) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long baseMillis = baseDelay.toMillis();
        long capped = Math.min(maxDelay.toMillis(), baseMillis * (1L << exponent));
        long jitter = Math.round(capped * jitterRatio * random);
        return Duration.ofMillis(capped + jitter);
    }

    public Duration delayWithoutJitter(int attempt) {
        return delay(attempt, 0.0);
    }
}
