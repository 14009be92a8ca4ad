package com.discernus.dispatch;

import com.discernus.health.FailureClass;

/** A model call that failed, classified for retry and health decisions. */
public class ModelCallException extends RuntimeException {
    private final FailureClass failureClass;
    private final int statusCode;

    public ModelCallException(FailureClass failureClass, String message) {
        this(failureClass, -1, message, null);
    }

    public ModelCallException(FailureClass failureClass, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.failureClass = failureClass;
        this.statusCode = statusCode;
    }

    public FailureClass failureClass() {
        return failureClass;
    }

    public int statusCode() {
        return statusCode;
    }
}
