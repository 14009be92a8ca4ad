package com.discernus.health;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldResolveQuotaClassFromDeclaredLimits() throws Exception {
        Path path = tempDir.resolve("models.yml");
        Files.writeString(path, """
                models:
                  - id: gpt-4o
                    provider: openai
                    capability: flagship
                    tpm: 30000
                    rpm: 500
                    inputPricePer1M: 2.5
                    outputPricePer1M: 10
                    timeoutMs: 90000
                  - id: gemini
                    provider: vertex
                    capability: flagship
                """);

        ModelRegistry registry = ModelRegistry.load(path);

        ModelDescriptor fixed = registry.require("gpt-4o");
        assertEquals(QuotaClass.FIXED, fixed.quotaClass());
        assertEquals(500, fixed.rateLimits().requestsPerMinute());
        assertEquals(Duration.ofSeconds(90), fixed.timeout());
        assertEquals(0.0125, fixed.cost(1000, 1000), 1e-9);
        ModelDescriptor shared = registry.require("gemini");
        assertEquals(QuotaClass.DYNAMIC_SHARED, shared.quotaClass());
        assertNull(shared.rateLimits());
        assertEquals("gpt-4o", registry.all().get(0).id());
    }

    @Test
    void shouldRejectQuotaClassInconsistentWithLimits() throws Exception {
        Path path = tempDir.resolve("models.yml");
        Files.writeString(path, """
                models:
                  - id: confused
                    provider: openai
                    quotaClass: DYNAMIC_SHARED
                    rpm: 60
                """);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> ModelRegistry.load(path));
        assertTrue(error.getMessage().contains("confused"));
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> new ModelRegistry(List.of(
                ModelDescriptor.dynamicShared("a", "p", "x"),
                ModelDescriptor.dynamicShared("a", "p", "y"))));
    }
}
