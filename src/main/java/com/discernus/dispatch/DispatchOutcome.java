package com.discernus.dispatch;

import java.time.Duration;

import com.discernus.health.FailureClass;
import com.discernus.health.HealthTransition;

/**
 * Result of a single dispatch attempt. Exactly one of {@code response} or
 * {@code failureClass} is set.
 */
public record DispatchOutcome(
        Kind kind,
        String modelId,
        ModelResponse response,
        double cost,
        FailureClass failureClass,
        String detail,
        Duration retryAfter,
        HealthTransition transition) {

    public enum Kind {
        SUCCESS,
        TRANSIENT_FAILURE,
        TERMINAL_FAILURE
    }

    public static DispatchOutcome success(String modelId, ModelResponse response, double cost, HealthTransition transition) {
        return new DispatchOutcome(Kind.SUCCESS, modelId, response, cost, null, "", Duration.ZERO, transition);
    }

    public static DispatchOutcome transientFailure(String modelId, FailureClass failureClass, String detail,
            Duration retryAfter, HealthTransition transition) {
        return new DispatchOutcome(Kind.TRANSIENT_FAILURE, modelId, null, 0.0, failureClass, detail, retryAfter, transition);
    }

    public static DispatchOutcome terminalFailure(String modelId, FailureClass failureClass, String detail,
            Duration retryAfter, HealthTransition transition) {
        return new DispatchOutcome(Kind.TERMINAL_FAILURE, modelId, null, 0.0, failureClass, detail, retryAfter, transition);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /** The exception a caller outside the retry loop would see for this failure. */
    public ModelCallException toException() {
        if (kind == Kind.SUCCESS) {
            throw new IllegalStateException("Successful dispatch has no failure");
        }
        if (failureClass == FailureClass.QUOTA_VIOLATION) {
            return new QuotaViolationException(modelId, detail, retryAfter);
        }
        if (kind == Kind.TRANSIENT_FAILURE) {
            return new TransientDispatchException(modelId, failureClass, detail, retryAfter);
        }
        return new ModelCallException(failureClass, "Terminal failure on " + modelId + " (" + failureClass + "): " + detail);
    }
}
