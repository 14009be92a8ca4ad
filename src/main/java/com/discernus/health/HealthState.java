package com.discernus.health;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNAVAILABLE;

    HealthState worst(HealthState other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
