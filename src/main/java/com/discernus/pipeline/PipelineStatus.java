package com.discernus.pipeline;

public enum PipelineStatus {
    SUCCESS(0),
    PARTIAL_FAILURE(3),
    FATAL_FAILURE(4),
    CANCELLED(5);

    private final int exitCode;

    PipelineStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
