package com.discernus.health;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Builds the strategy object for a model's quota class. */
public class DispatchStrategies {
    private final BackoffPolicy backoff;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public DispatchStrategies(BackoffPolicy backoff) {
        this(backoff, Ticker.SYSTEM, Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble());
    }

    public DispatchStrategies(BackoffPolicy backoff, Ticker ticker, Sleeper sleeper, DoubleSupplier random) {
        this.backoff = backoff;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.random = random;
    }

    public DispatchStrategy forModel(ModelDescriptor descriptor) {
        return switch (descriptor.quotaClass()) {
            case FIXED -> new FixedQuotaStrategy(
                    new SlidingWindowRateLimiter(descriptor.id(), descriptor.rateLimits(), ticker, sleeper),
                    backoff);
            case DYNAMIC_SHARED -> new DynamicSharedStrategy(backoff, random);
        };
    }
}
