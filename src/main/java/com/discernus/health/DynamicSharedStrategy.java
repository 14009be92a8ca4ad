package com.discernus.health;

import java.time.Duration;
import java.util.Optional;
import java.util.function.DoubleSupplier;

public class DynamicSharedStrategy implements DispatchStrategy {
    private final BackoffPolicy backoff;
    private final DoubleSupplier random;

    public DynamicSharedStrategy(BackoffPolicy backoff, DoubleSupplier random) {
        this.backoff = backoff;
        this.random = random;
    }

    @Override
    public QuotaClass quotaClass() {
        return QuotaClass.DYNAMIC_SHARED;
    }

    @Override
    public Duration admit(int estimatedTokens) {
        return Duration.ZERO;
    }

    @Override
    public void recordUsage(int estimatedTokens, int actualTokens) {
    }

    @Override
    public FailureClass timeoutFailure() {
        // a shared pool that stops answering is out of capacity
        return FailureClass.CAPACITY_EXHAUSTED;
    }

    @Override
    public boolean isRetryable(FailureClass failure) {
        return failure.isTransient();
    }

    @Override
    public Duration retryDelay(int attempt, FailureClass failure) {
        return backoff.delay(attempt, random.getAsDouble());
    }

    @Override
    public Optional<Duration> quotaRetryAfter(int estimatedTokens) {
        return Optional.empty();
    }
}
