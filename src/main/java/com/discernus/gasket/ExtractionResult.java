package com.discernus.gasket;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload plus the path that produced it. {@code payload} is null when the
 * outcome is {@code FAILED}; {@code rawPayload} keeps the best parseable text for
 * diagnosis.
 */
public record ExtractionResult(JsonNode payload, ExtractionOutcome outcome, String rawPayload) {

    public static ExtractionResult success(JsonNode payload, ExtractionOutcome outcome) {
        return new ExtractionResult(payload, outcome, payload.toString());
    }

    public static ExtractionResult failure(ExtractionOutcome outcome, String rawPayload) {
        return new ExtractionResult(null, outcome, rawPayload);
    }

    public JsonNode payloadOrThrow(PayloadSchema schema) {
        if (!outcome.isFailed()) {
            return payload;
        }
        throw failureCause(schema);
    }

    /** The exception describing this failed extraction. */
    public RuntimeException failureCause(PayloadSchema schema) {
        if (!outcome.isFailed()) {
            throw new IllegalStateException("Extraction succeeded: " + outcome);
        }
        if (outcome.failureKind() == ExtractionOutcome.FailureKind.SCHEMA_VIOLATION) {
            return new SchemaViolationException(schema, outcome.reason(), rawPayload);
        }
        return new ExtractionException(schema, outcome.reason());
    }
}
