package com.discernus.dispatch;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discernus.health.CallOutcome;
import com.discernus.health.DispatchStrategy;
import com.discernus.health.FailureClass;
import com.discernus.health.HealthTransition;
import com.discernus.health.ModelDescriptor;
import com.discernus.health.ModelHealthManager;

/**
 * Sends one attempt to a model: local admission through the model's strategy,
 * the call itself under a deadline, then classification and health recording.
 * Retrying is left to the caller.
 */
public class ModelDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ModelDispatcher.class);

    private final ModelHealthManager healthManager;
    private final ModelClient client;
    private final ExecutorService callExecutor;

    public ModelDispatcher(ModelHealthManager healthManager, ModelClient client) {
        this(healthManager, client, Executors.newCachedThreadPool(daemonThreads()));
    }

    public ModelDispatcher(ModelHealthManager healthManager, ModelClient client, ExecutorService callExecutor) {
        this.healthManager = healthManager;
        this.client = client;
        this.callExecutor = callExecutor;
    }

    public ModelHealthManager healthManager() {
        return healthManager;
    }

    public DispatchOutcome dispatch(String modelId, ModelRequest request, int attempt, CancellationToken cancellation) {
        ModelDescriptor descriptor = healthManager.registry().require(modelId);
        return dispatch(descriptor, request, attempt, descriptor.timeout(), cancellation);
    }

    public DispatchOutcome dispatch(ModelDescriptor descriptor, ModelRequest request, int attempt, Duration deadline,
            CancellationToken cancellation) {
        String modelId = descriptor.id();
        DispatchStrategy strategy = healthManager.selectDispatchStrategy(modelId);
        int estimatedTokens = request.estimatedTokens();
        cancellation.throwIfCancelled();
        try {
            Duration waited = strategy.admit(estimatedTokens);
            if (!waited.isZero()) {
                log.debug("dispatch.admitted model={} waitedMs={}", modelId, waited.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted waiting for rate limit on " + modelId);
        }
        cancellation.throwIfCancelled();

        Future<ModelResponse> call = callExecutor.submit(() -> client.complete(descriptor, request));
        Runnable unregister = cancellation.onCancel(() -> call.cancel(true));
        try {
            ModelResponse response = call.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            strategy.recordUsage(estimatedTokens, response.totalTokens());
            HealthTransition transition = healthManager.recordOutcome(modelId, CallOutcome.success());
            double cost = descriptor.cost(response.promptTokens(), response.completionTokens());
            log.info("dispatch.success model={} attempt={} promptTokens={} completionTokens={} cost={}",
                    modelId, attempt, response.promptTokens(), response.completionTokens(), cost);
            return DispatchOutcome.success(modelId, response, cost, transition);
        } catch (TimeoutException e) {
            call.cancel(true);
            return failed(descriptor, strategy, attempt, estimatedTokens, strategy.timeoutFailure(),
                    "no response within " + deadline.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelCallException callException) {
                return failed(descriptor, strategy, attempt, estimatedTokens, callException.failureClass(), callException.getMessage());
            }
            return failed(descriptor, strategy, attempt, estimatedTokens, FailureClass.SERVER_ERROR,
                    cause == null ? e.getMessage() : cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (CancellationException e) {
            throw new CancellationException("dispatch to " + modelId + " cancelled: " + cancellation.reason());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted during dispatch to " + modelId);
        } finally {
            unregister.run();
        }
    }

    private DispatchOutcome failed(ModelDescriptor descriptor, DispatchStrategy strategy, int attempt, int estimatedTokens,
            FailureClass failureClass, String detail) {
        String modelId = descriptor.id();
        HealthTransition transition = healthManager.recordOutcome(modelId, CallOutcome.failure(failureClass, detail));
        if (strategy.isRetryable(failureClass)) {
            Duration retryAfter = strategy.retryDelay(attempt, failureClass);
            log.warn("dispatch.transient model={} attempt={} class={} retryAfterMs={} detail={}",
                    modelId, attempt, failureClass, retryAfter.toMillis(), detail);
            return DispatchOutcome.transientFailure(modelId, failureClass, detail, retryAfter, transition);
        }
        Duration retryAfter = failureClass == FailureClass.QUOTA_VIOLATION
                ? strategy.quotaRetryAfter(estimatedTokens).orElse(null)
                : null;
        log.error("dispatch.terminal model={} attempt={} class={} detail={}", modelId, attempt, failureClass, detail);
        return DispatchOutcome.terminalFailure(modelId, failureClass, detail, retryAfter, transition);
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "model-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
