package com.discernus.dispatch;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation shared by a run. Cancelling fires registered callbacks
 * (used to cancel in-flight call futures) and wakes any backoff sleep.
 */
public class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile String reason = "";

    public void cancel(String why) {
        if (!cancelRequested.compareAndSet(false, true)) {
            return;
        }
        reason = why == null ? "" : why;
        cancelled.countDown();
        log.info("run.cancel reason={}", reason);
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("run.cancel.callback-failed reason={}", e.getMessage(), e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("cancelled: " + reason);
        }
    }

    /** Registers a callback and returns a handle that unregisters it. */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /** Sleeps for {@code duration} unless cancelled first, in which case it throws. */
    public void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            throwIfCancelled();
            return;
        }
        try {
            if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CancellationException("cancelled: " + reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while backing off");
        }
    }
}
