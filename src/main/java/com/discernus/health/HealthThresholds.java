package com.discernus.health;

public record HealthThresholds(int degradedAfterFailures, int unavailableAfterFailures) {
    public static final HealthThresholds DEFAULT = new HealthThresholds(1, 5);

    public HealthThresholds {
        if (degradedAfterFailures < 1 || unavailableAfterFailures < degradedAfterFailures) {
            throw new IllegalArgumentException("Health thresholds must satisfy 1 <= degraded <= unavailable");
        }
    }
}
