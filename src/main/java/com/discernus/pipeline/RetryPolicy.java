package com.discernus.pipeline;

import java.time.Duration;
import java.util.List;

import com.discernus.health.BackoffPolicy;

/**
 * Decides from the attempt history alone whether to try again and after how long.
 * Holds no state; the same history and random draw always give the same decision.
 */
public record RetryPolicy(int maxAttempts, BackoffPolicy backoff) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(3, BackoffPolicy.DEFAULT);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public RetryPolicy withMaxAttempts(Integer override) {
        return override == null ? this : new RetryPolicy(override, backoff);
    }

    public RetryDecision decide(List<AttemptOutcome> history, double random) {
        if (history.isEmpty()) {
            return RetryDecision.retryAfter(Duration.ZERO, "first attempt");
        }
        AttemptOutcome last = history.get(history.size() - 1);
        switch (last.kind()) {
            case SUCCESS:
                return RetryDecision.giveUp("succeeded");
            case TERMINAL_FAILURE:
                return RetryDecision.giveUp("terminal: " + describe(last));
            default:
                break;
        }
        int attempts = history.size();
        if (attempts >= maxAttempts) {
            return RetryDecision.giveUp("exhausted " + attempts + " attempts, last: " + describe(last));
        }
        Duration backoffDelay = backoff.delay(attempts, random);
        Duration delay = last.retryAfter().compareTo(backoffDelay) > 0 ? last.retryAfter() : backoffDelay;
        return RetryDecision.retryAfter(delay, describe(last));
    }

    private static String describe(AttemptOutcome outcome) {
        return outcome.failureClass() == null ? outcome.detail() : outcome.failureClass() + " " + outcome.detail();
    }

    public record RetryDecision(boolean retry, Duration delay, String reason) {
        static RetryDecision retryAfter(Duration delay, String reason) {
            return new RetryDecision(true, delay, reason);
        }

        static RetryDecision giveUp(String reason) {
            return new RetryDecision(false, Duration.ZERO, reason);
        }
    }
}
