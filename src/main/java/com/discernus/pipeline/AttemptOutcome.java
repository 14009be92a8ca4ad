package com.discernus.pipeline;

import java.time.Duration;

import com.discernus.dispatch.DispatchOutcome;
import com.discernus.gasket.ExtractionOutcome;
import com.discernus.health.FailureClass;

/** What happened on one attempt of a stage, dispatch and extraction together. */
public record AttemptOutcome(Kind kind, String modelId, FailureClass failureClass, String detail, Duration retryAfter) {

    public enum Kind {
        SUCCESS,
        TRANSIENT_FAILURE,
        TERMINAL_FAILURE
    }

    public AttemptOutcome {
        retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
        detail = detail == null ? "" : detail;
    }

    public static AttemptOutcome success(String modelId) {
        return new AttemptOutcome(Kind.SUCCESS, modelId, null, "", Duration.ZERO);
    }

    public static AttemptOutcome fromDispatch(DispatchOutcome outcome) {
        Kind kind = switch (outcome.kind()) {
            case SUCCESS -> Kind.SUCCESS;
            case TRANSIENT_FAILURE -> Kind.TRANSIENT_FAILURE;
            case TERMINAL_FAILURE -> Kind.TERMINAL_FAILURE;
        };
        return new AttemptOutcome(kind, outcome.modelId(), outcome.failureClass(), outcome.detail(), outcome.retryAfter());
    }

    /** Malformed output is worth another call; a schema violation is not. */
    public static AttemptOutcome fromExtraction(String modelId, ExtractionOutcome outcome) {
        if (!outcome.isFailed()) {
            return success(modelId);
        }
        Kind kind = outcome.failureKind() == ExtractionOutcome.FailureKind.SCHEMA_VIOLATION
                ? Kind.TERMINAL_FAILURE
                : Kind.TRANSIENT_FAILURE;
        return new AttemptOutcome(kind, modelId, null, "extraction " + outcome.failureKind() + ": " + outcome.reason(), Duration.ZERO);
    }

    public static AttemptOutcome cancelledByHealth(String modelId, String reason) {
        return new AttemptOutcome(Kind.TERMINAL_FAILURE, modelId, null, "model unavailable: " + reason, Duration.ZERO);
    }
}
