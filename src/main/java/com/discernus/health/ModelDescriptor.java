package com.discernus.health;

import java.time.Duration;

public record ModelDescriptor(
        String id,
        String provider,
        String capability,
        QuotaClass quotaClass,
        RateLimits rateLimits,
        double inputPricePer1M,
        double outputPricePer1M,
        Duration timeout) {

    public ModelDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Model id is required");
        }
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("Model " + id + " needs a provider");
        }
        if (quotaClass == QuotaClass.FIXED && rateLimits == null) {
            throw new IllegalArgumentException("Fixed-quota model " + id + " needs rate limits");
        }
        if (quotaClass == QuotaClass.DYNAMIC_SHARED && rateLimits != null) {
            throw new IllegalArgumentException("Dynamic-shared model " + id + " must not declare tpm/rpm");
        }
        capability = capability == null || capability.isBlank() ? "default" : capability;
        timeout = timeout == null ? Duration.ofSeconds(120) : timeout;
    }

    public static ModelDescriptor fixed(String id, String provider, String capability, Integer tpm, Integer rpm) {
        return new ModelDescriptor(id, provider, capability, QuotaClass.FIXED, new RateLimits(tpm, rpm), 0.0, 0.0, null);
    }

    public static ModelDescriptor dynamicShared(String id, String provider, String capability) {
        return new ModelDescriptor(id, provider, capability, QuotaClass.DYNAMIC_SHARED, null, 0.0, 0.0, null);
    }

    public double cost(int promptTokens, int completionTokens) {
        return (promptTokens * inputPricePer1M + completionTokens * outputPricePer1M) / 1_000_000d;
    }
}
