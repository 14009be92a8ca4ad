package com.discernus.health;

import java.time.Duration;
import java.util.Optional;

public class FixedQuotaStrategy implements DispatchStrategy {
    private final SlidingWindowRateLimiter limiter;
    private final BackoffPolicy backoff;

    public FixedQuotaStrategy(SlidingWindowRateLimiter limiter, BackoffPolicy backoff) {
        this.limiter = limiter;
        this.backoff = backoff;
    }

    @Override
    public QuotaClass quotaClass() {
        return QuotaClass.FIXED;
    }

    @Override
    public Duration admit(int estimatedTokens) throws InterruptedException {
        return limiter.acquire(estimatedTokens);
    }

    @Override
    public void recordUsage(int estimatedTokens, int actualTokens) {
        limiter.correctLastUsage(estimatedTokens, actualTokens);
    }

    @Override
    public FailureClass timeoutFailure() {
        return FailureClass.TIMEOUT;
    }

    @Override
    public boolean isRetryable(FailureClass failure) {
        return failure.isTransient();
    }

    @Override
    public Duration retryDelay(int attempt, FailureClass failure) {
        return backoff.delayWithoutJitter(attempt);
    }

    @Override
    public Optional<Duration> quotaRetryAfter(int estimatedTokens) {
        return Optional.of(limiter.timeUntilAvailable(estimatedTokens));
    }

    public SlidingWindowRateLimiter limiter() {
        return limiter;
    }
}
