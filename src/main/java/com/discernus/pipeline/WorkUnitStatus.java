package com.discernus.pipeline;

public enum WorkUnitStatus {
    PENDING,
    CACHE_CHECK,
    DISPATCHING,
    EXTRACTING,
    RETRYING,
    DONE,
    FAILED,
    CANCELLED
}
