package com.discernus.dispatch;

import java.time.Duration;

import com.discernus.health.FailureClass;

public class TransientDispatchException extends ModelCallException {
    private final Duration retryAfter;

    public TransientDispatchException(String modelId, FailureClass failureClass, String detail, Duration retryAfter) {
        super(failureClass, -1, "Transient failure on " + modelId + " (" + failureClass + "): " + detail, null);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
