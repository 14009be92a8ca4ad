package com.discernus.health;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-quota-class dispatch behaviour, resolved once when the model registry is
 * loaded.
 */
public interface DispatchStrategy {
    QuotaClass quotaClass();

    /** Waits for local admission. Dynamic-shared models return immediately. */
    Duration admit(int estimatedTokens) throws InterruptedException;

    /** Reports measured usage after a call so the window reflects real tokens. */
    void recordUsage(int estimatedTokens, int actualTokens);

    /** The failure class a deadline expiry counts as. */
    FailureClass timeoutFailure();

    boolean isRetryable(FailureClass failure);

    /**
     * Suggested wait before the next attempt, {@code attempt} being the number of
     * the attempt that just failed.
     */
    Duration retryDelay(int attempt, FailureClass failure);

    /** For quota violations: when the local window would next admit a call. */
    Optional<Duration> quotaRetryAfter(int estimatedTokens);
}
