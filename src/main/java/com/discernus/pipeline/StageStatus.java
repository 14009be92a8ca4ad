package com.discernus.pipeline;

public enum StageStatus {
    CACHED,
    COMPUTED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean succeeded() {
        return this == CACHED || this == COMPUTED;
    }
}
