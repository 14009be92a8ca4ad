package com.discernus.runtime;

import org.junit.jupiter.api.Test;

import com.discernus.gasket.MultipleBlockPolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToThreeAttemptsAndStandardHealthThresholds() {
        AppConfig config = new AppConfig();

        assertEquals(3, config.getRetry().getMaxAttempts());
        assertEquals(1000, config.getRetry().getBaseBackoffMs());
        assertEquals(1, config.getHealth().getDegradedAfterFailures());
        assertEquals(5, config.getHealth().getUnavailableAfterFailures());
        assertEquals(MultipleBlockPolicy.LAST, config.getGasket().getMultipleBlockPolicy());
        assertNull(config.getGasket().getSecondaryModel());
        assertEquals("models.yml", config.getModelRegistryPath());
        assertTrue(config.getModels().isEmpty());
    }
}
