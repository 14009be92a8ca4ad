package com.discernus.health;

public record ModelStatus(ModelDescriptor descriptor, HealthState state, int consecutiveFailures) {
}
