package com.discernus.gasket;

public record ExtractionOutcome(Kind kind, FailureKind failureKind, String reason) {

    public enum Kind {
        CLEAN,
        RECOVERED_VIA_FALLBACK,
        RECOVERED_VIA_SECONDARY_CALL,
        FAILED
    }

    public enum FailureKind {
        MALFORMED,
        SCHEMA_VIOLATION
    }

    public static ExtractionOutcome clean() {
        return new ExtractionOutcome(Kind.CLEAN, null, "");
    }

    public static ExtractionOutcome recoveredViaFallback(String reason) {
        return new ExtractionOutcome(Kind.RECOVERED_VIA_FALLBACK, null, reason);
    }

    public static ExtractionOutcome recoveredViaSecondaryCall(String reason) {
        return new ExtractionOutcome(Kind.RECOVERED_VIA_SECONDARY_CALL, null, reason);
    }

    public static ExtractionOutcome failed(FailureKind failureKind, String reason) {
        return new ExtractionOutcome(Kind.FAILED, failureKind, reason);
    }

    public boolean isClean() {
        return kind == Kind.CLEAN;
    }

    public boolean isRecovered() {
        return kind == Kind.RECOVERED_VIA_FALLBACK || kind == Kind.RECOVERED_VIA_SECONDARY_CALL;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    @Override
    public String toString() {
        return isFailed() ? kind + "(" + failureKind + ": " + reason + ")" : kind.name();
    }
}
