package com.discernus.health;

public record CallOutcome(FailureClass failureClass, String detail) {
    private static final CallOutcome SUCCESS = new CallOutcome(null, "");

    public static CallOutcome success() {
        return SUCCESS;
    }

    public static CallOutcome failure(FailureClass failureClass, String detail) {
        if (failureClass == null) {
            throw new IllegalArgumentException("failureClass is required for a failed call");
        }
        return new CallOutcome(failureClass, detail == null ? "" : detail);
    }

    public boolean isSuccess() {
        return failureClass == null;
    }
}
