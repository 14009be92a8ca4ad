package com.discernus.health;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/** Mutable health of one model; updated without locks. */
final class ModelHealth {
    private final String modelId;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<HealthState> state = new AtomicReference<>(HealthState.HEALTHY);

    ModelHealth(String modelId) {
        this.modelId = modelId;
    }

    HealthTransition record(CallOutcome outcome, HealthThresholds thresholds) {
        if (outcome.isSuccess()) {
            consecutiveFailures.set(0);
            HealthState previous = state.getAndSet(HealthState.HEALTHY);
            return new HealthTransition(modelId, previous, HealthState.HEALTHY, 0, null);
        }
        int failures = consecutiveFailures.incrementAndGet();
        HealthState target;
        if (outcome.failureClass().isFatal() || failures >= thresholds.unavailableAfterFailures()) {
            target = HealthState.UNAVAILABLE;
        } else if (failures >= thresholds.degradedAfterFailures()) {
            target = HealthState.DEGRADED;
        } else {
            target = HealthState.HEALTHY;
        }
        HealthState previous;
        HealthState next;
        do {
            previous = state.get();
            next = previous.worst(target);
        } while (!state.compareAndSet(previous, next));
        return new HealthTransition(modelId, previous, next, failures, outcome.failureClass());
    }

    HealthState state() {
        return state.get();
    }

    int consecutiveFailures() {
        return consecutiveFailures.get();
    }
}
