package com.discernus.dispatch;

import java.time.Duration;

import com.discernus.health.FailureClass;

/** Hard quota breach. Not retried with backoff; carries when the local window would admit again, if known. */
public class QuotaViolationException extends ModelCallException {
    private final Duration retryAfter;

    public QuotaViolationException(String modelId, String detail, Duration retryAfter) {
        super(FailureClass.QUOTA_VIOLATION, -1, "Quota violation on " + modelId + ": " + detail
                + (retryAfter == null ? "" : " (retry after " + retryAfter.toMillis() + "ms)"), null);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
