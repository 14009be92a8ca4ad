package com.discernus.health;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sixty-second sliding window over requests and tokens. A request that would
 * overflow either budget waits locally until enough of the window has expired.
 */
public class SlidingWindowRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);
    static final Duration WINDOW = Duration.ofSeconds(60);

    private final String modelId;
    private final Integer requestsPerMinute;
    private final Integer tokensPerMinute;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final Deque<Usage> usage = new ArrayDeque<>();
    private final AtomicLong delayedRequests = new AtomicLong();
    private long tokensInWindow;

    public SlidingWindowRateLimiter(String modelId, RateLimits limits, Ticker ticker, Sleeper sleeper) {
        this.modelId = modelId;
        this.requestsPerMinute = limits.requestsPerMinute();
        this.tokensPerMinute = limits.tokensPerMinute();
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a request of {@code estimatedTokens} fits the window and then
     * records it. Returns the total time spent waiting.
     */
    public Duration acquire(int estimatedTokens) throws InterruptedException {
        int tokens = Math.max(0, estimatedTokens);
        long waitedNanos = 0;
        boolean delayed = false;
        while (true) {
            long waitNanos;
            synchronized (this) {
                long now = ticker.nanoTime();
                evict(now);
                waitNanos = nanosUntilAvailable(now, tokens);
                if (waitNanos <= 0) {
                    usage.addLast(new Usage(now, tokens));
                    tokensInWindow += tokens;
                    return Duration.ofNanos(waitedNanos);
                }
            }
            if (!delayed) {
                delayed = true;
                delayedRequests.incrementAndGet();
                log.info("ratelimit.delay model={} waitMs={} tokens={}", modelId, Duration.ofNanos(waitNanos).toMillis(), tokens);
            }
            sleeper.sleep(Duration.ofNanos(waitNanos));
            waitedNanos += waitNanos;
        }
    }

    /** Time until a request of the given size would be admitted, without reserving it. */
    public synchronized Duration timeUntilAvailable(int estimatedTokens) {
        long now = ticker.nanoTime();
        evict(now);
        return Duration.ofNanos(Math.max(0, nanosUntilAvailable(now, Math.max(0, estimatedTokens))));
    }

    /** Replaces an estimate with the measured token count of the most recent matching request. */
    public synchronized void correctLastUsage(int estimatedTokens, int actualTokens) {
        if (actualTokens < 0 || estimatedTokens == actualTokens) {
            return;
        }
        for (var iterator = usage.descendingIterator(); iterator.hasNext();) {
            Usage entry = iterator.next();
            if (entry.tokens == estimatedTokens) {
                tokensInWindow += actualTokens - entry.tokens;
                entry.tokens = actualTokens;
                return;
            }
        }
    }

    public long delayedRequests() {
        return delayedRequests.get();
    }

    synchronized int requestsInWindow() {
        evict(ticker.nanoTime());
        return usage.size();
    }

    private void evict(long now) {
        long windowNanos = WINDOW.toNanos();
        while (!usage.isEmpty() && now - usage.peekFirst().at >= windowNanos) {
            tokensInWindow -= usage.pollFirst().tokens;
        }
    }

    private long nanosUntilAvailable(long now, int tokens) {
        long windowNanos = WINDOW.toNanos();
        long wait = 0;
        if (requestsPerMinute != null && usage.size() >= requestsPerMinute) {
            int toExpire = usage.size() - requestsPerMinute + 1;
            Usage boundary = nth(toExpire - 1);
            wait = Math.max(wait, boundary.at + windowNanos - now);
        }
        if (tokensPerMinute != null && tokensInWindow + tokens > tokensPerMinute) {
            if (tokens > tokensPerMinute) {
                // can never fit; admit once the window is empty
                Usage newest = usage.peekLast();
                return newest == null ? 0 : newest.at + windowNanos - now;
            }
            long remaining = tokensInWindow;
            for (Usage entry : usage) {
                remaining -= entry.tokens;
                if (remaining + tokens <= tokensPerMinute) {
                    wait = Math.max(wait, entry.at + windowNanos - now);
                    break;
                }
            }
        }
        return wait;
    }

    private Usage nth(int index) {
        int i = 0;
        for (Usage entry : usage) {
            if (i++ == index) {
                return entry;
            }
        }
        throw new IllegalStateException("window holds fewer than " + (index + 1) + " entries");
    }

    private static final class Usage {
        private final long at;
        private int tokens;

        private Usage(long at, int tokens) {
            this.at = at;
            this.tokens = tokens;
        }
    }
}
