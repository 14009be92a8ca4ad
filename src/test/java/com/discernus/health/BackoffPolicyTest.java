package com.discernus.health;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BackoffPolicyTest {
    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 0.5);

    @Test
    void shouldDoubleDelayPerAttemptUpToCap() {
        assertEquals(Duration.ofMillis(100), policy.delayWithoutJitter(1));
        assertEquals(Duration.ofMillis(200), policy.delayWithoutJitter(2));
        assertEquals(Duration.ofMillis(800), policy.delayWithoutJitter(4));
        assertEquals(Duration.ofSeconds(1), policy.delayWithoutJitter(5));
        assertEquals(Duration.ofSeconds(1), policy.delayWithoutJitter(64));
    }

    @Test
    void shouldAddProportionalJitter() {
        assertEquals(Duration.ofMillis(150), policy.delay(1, 1.0));
        assertEquals(Duration.ofMillis(250), policy.delay(2, 0.5));
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), 1.5));
    }
}
