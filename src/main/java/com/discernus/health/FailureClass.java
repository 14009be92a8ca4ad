package com.discernus.health;

public enum FailureClass {
    CAPACITY_EXHAUSTED(true, false),
    TIMEOUT(true, false),
    NETWORK(true, false),
    SERVER_ERROR(true, false),
    QUOTA_VIOLATION(false, true),
    AUTHENTICATION(false, true),
    INVALID_REQUEST(false, true);

    private final boolean transientFailure;
    private final boolean fatal;

    FailureClass(boolean transientFailure, boolean fatal) {
        this.transientFailure = transientFailure;
        this.fatal = fatal;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /** Fatal classes make the model unavailable immediately. */
    public boolean isFatal() {
        return fatal;
    }
}
