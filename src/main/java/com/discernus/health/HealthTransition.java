package com.discernus.health;

public record HealthTransition(
        String modelId,
        HealthState previous,
        HealthState current,
        int consecutiveFailures,
        FailureClass cause) {

    public boolean changed() {
        return previous != current;
    }

    public boolean isReset() {
        return current == HealthState.HEALTHY && previous != HealthState.HEALTHY;
    }
}
