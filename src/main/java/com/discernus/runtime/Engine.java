package com.discernus.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discernus.dispatch.ModelClient;
import com.discernus.dispatch.ModelDispatcher;
import com.discernus.dispatch.OkHttpModelClient;
import com.discernus.dispatch.ProviderEndpoint;
import com.discernus.dispatch.SecondaryExtractionClient;
import com.discernus.gasket.GasketExtractor;
import com.discernus.gasket.MarkerProtocol;
import com.discernus.gasket.StructuredExtractionClient;
import com.discernus.health.BackoffPolicy;
import com.discernus.health.DispatchStrategies;
import com.discernus.health.HealthThresholds;
import com.discernus.health.ModelHealthManager;
import com.discernus.health.ModelRegistry;
import com.discernus.pipeline.PipelineOrchestrator;
import com.discernus.pipeline.RetryPolicy;
import com.discernus.pipeline.RunLedger;
import com.discernus.pipeline.SchemaProvider;
import com.discernus.store.LocalArtifactStore;

import okhttp3.OkHttpClient;

/** Wires the store, health manager, dispatcher, extractor and orchestrator from an {@link AppConfig}. */
public final class Engine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Engine.class);

    private final LocalArtifactStore store;
    private final ModelHealthManager healthManager;
    private final ModelDispatcher dispatcher;
    private final RunLedger ledger;
    private final ExecutorService workers;
    private final PipelineOrchestrator orchestrator;

    private Engine(LocalArtifactStore store, ModelHealthManager healthManager, ModelDispatcher dispatcher, RunLedger ledger,
            ExecutorService workers, PipelineOrchestrator orchestrator) {
        this.store = store;
        this.healthManager = healthManager;
        this.dispatcher = dispatcher;
        this.ledger = ledger;
        this.workers = workers;
        this.orchestrator = orchestrator;
    }

    /**
     * @param configDir directory relative model registry paths are resolved against
     * @param client    model client to use, or null for the OkHttp client built from {@code providers}
     * @param environment lookup for API key environment variables
     */
    public static Engine create(AppConfig config, Path configDir, ModelClient client, UnaryOperator<String> environment)
            throws IOException {
        ModelRegistry registry = loadRegistry(config, configDir);
        AppConfig.RetryConfig retry = config.getRetry();
        BackoffPolicy backoff = new BackoffPolicy(
                Duration.ofMillis(retry.getBaseBackoffMs()),
                Duration.ofMillis(retry.getMaxBackoffMs()),
                retry.getJitterRatio());
        HealthThresholds thresholds = new HealthThresholds(
                config.getHealth().getDegradedAfterFailures(),
                config.getHealth().getUnavailableAfterFailures());
        ModelHealthManager healthManager = new ModelHealthManager(registry, thresholds, new DispatchStrategies(backoff));

        ModelClient modelClient = client != null ? client : new OkHttpModelClient(new OkHttpClient(), endpoints(config, environment));
        ModelDispatcher dispatcher = new ModelDispatcher(healthManager, modelClient);

        AppConfig.GasketConfig gasket = config.getGasket();
        StructuredExtractionClient secondary = StructuredExtractionClient.NONE;
        if (gasket.getSecondaryModel() != null && !gasket.getSecondaryModel().isBlank()) {
            registry.require(gasket.getSecondaryModel());
            secondary = new SecondaryExtractionClient(dispatcher, gasket.getSecondaryModel());
        }
        GasketExtractor extractor = new GasketExtractor(
                new MarkerProtocol(gasket.getProtocolName(), gasket.getProtocolVersion()),
                gasket.getMultipleBlockPolicy(),
                secondary);

        if (config.getEngine().getWorkerThreads() < 1) {
            throw new IllegalArgumentException("engine.workerThreads must be >= 1");
        }
        LocalArtifactStore store = LocalArtifactStore.open(Path.of(config.getEngine().getStorePath()));
        RunLedger ledger = new RunLedger(Path.of(config.getEngine().getLedgerPath()));
        ExecutorService workers = Executors.newFixedThreadPool(config.getEngine().getWorkerThreads(), stageThreads());
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                store,
                dispatcher,
                extractor,
                new RetryPolicy(retry.getMaxAttempts(), backoff),
                ledger,
                workers,
                SchemaProvider.DECLARED,
                () -> ThreadLocalRandom.current().nextDouble());
        log.info("engine.ready models={} store={} workers={}",
                registry.all().size(), config.getEngine().getStorePath(), config.getEngine().getWorkerThreads());
        return new Engine(store, healthManager, dispatcher, ledger, workers, orchestrator);
    }

    static ModelRegistry loadRegistry(AppConfig config, Path configDir) throws IOException {
        if (!config.getModels().isEmpty()) {
            return ModelRegistry.fromEntries(config.getModels());
        }
        Path registryPath = configDir.resolve(config.getModelRegistryPath());
        return ModelRegistry.load(registryPath);
    }

    static Map<String, ProviderEndpoint> endpoints(AppConfig config, UnaryOperator<String> environment) {
        Map<String, ProviderEndpoint> endpoints = new LinkedHashMap<>();
        config.getProviders().forEach((name, provider) -> {
            String apiKey = provider.getApiKeyEnv() == null ? null : environment.apply(provider.getApiKeyEnv());
            if (provider.getApiKeyEnv() != null && (apiKey == null || apiKey.isBlank())) {
                log.warn("engine.provider.no-key provider={} env={}", name, provider.getApiKeyEnv());
            }
            endpoints.put(name, new ProviderEndpoint(provider.getBaseUrl(), apiKey));
        });
        return endpoints;
    }

    public LocalArtifactStore store() {
        return store;
    }

    public ModelHealthManager healthManager() {
        return healthManager;
    }

    public RunLedger ledger() {
        return ledger;
    }

    public PipelineOrchestrator orchestrator() {
        return orchestrator;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        dispatcher.close();
    }

    private static ThreadFactory stageThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> new Thread(runnable, "stage-worker-" + counter.incrementAndGet());
    }
}
