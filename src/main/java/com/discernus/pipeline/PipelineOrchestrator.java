package com.discernus.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discernus.dispatch.CancellationToken;
import com.discernus.dispatch.DispatchOutcome;
import com.discernus.dispatch.ModelDispatcher;
import com.discernus.dispatch.ModelRequest;
import com.discernus.gasket.ExtractionResult;
import com.discernus.gasket.GasketExtractor;
import com.discernus.gasket.PayloadSchema;
import com.discernus.health.ModelHealthManager;
import com.discernus.health.Recommendation;
import com.discernus.logging.MdcContext;
import com.discernus.pipeline.PipelineDefinition.SeedDefinition;
import com.discernus.pipeline.PipelineDefinition.StageDefinition;
import com.discernus.pipeline.RetryPolicy.RetryDecision;
import com.discernus.store.ArtifactOrigin;
import com.discernus.store.ArtifactStore;
import com.discernus.store.Fingerprint;
import com.discernus.store.PendingArtifact;
import com.discernus.store.ProvenanceRecord;
import com.discernus.store.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs a pipeline against the artifact store. Each stage computes its fingerprint
 * once its inputs exist, reuses a stored artifact when one is bound, and otherwise
 * dispatches, extracts and stores under single-flight protection. Independent
 * stages run concurrently on the worker pool.
 */
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ArtifactStore store;
    private final ModelDispatcher dispatcher;
    private final GasketExtractor extractor;
    private final RetryPolicy retryPolicy;
    private final RunLedger ledger;
    private final ExecutorService workers;
    private final SchemaProvider schemaProvider;
    private final DoubleSupplier random;
    private final FingerprintCalculator fingerprints = new FingerprintCalculator();
    private final PromptRenderer renderer = new PromptRenderer();
    private final ObjectMapper mapper = new ObjectMapper();

    public PipelineOrchestrator(
            ArtifactStore store,
            ModelDispatcher dispatcher,
            GasketExtractor extractor,
            RetryPolicy retryPolicy,
            RunLedger ledger,
            ExecutorService workers,
            SchemaProvider schemaProvider,
            DoubleSupplier random) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.extractor = extractor;
        this.retryPolicy = retryPolicy;
        this.ledger = ledger;
        this.workers = workers;
        this.schemaProvider = schemaProvider;
        this.random = random;
    }

    public RunReport run(PipelineDefinition definition, CancellationToken cancellation) {
        definition.validate();
        StageGraph graph = StageGraph.of(definition);
        ModelHealthManager health = dispatcher.healthManager();
        for (StageDefinition stage : definition.getStages()) {
            health.registry().require(stage.getModel());
        }

        RunContext run = new RunContext(UUID.randomUUID().toString(), definition, cancellation);
        Runnable unregister = cancellation.onCancel(() -> run.token.cancel(cancellation.reason()));
        MdcContext.setRun(run.runId);
        Instant startedAt = Instant.now();
        try {
            log.info("run.start pipeline={} stages={}", definition.getName(), definition.getStages().size());
            ledger.append(RunEvent.of(run.runId, "run.start", null, null, null, definition.getName()));
            storeSeeds(run);
            resolveModels(run);

            Map<String, CompletableFuture<StageResult>> futures = new LinkedHashMap<>();
            for (String stageId : graph.topologicalOrder()) {
                StageDefinition stage = definition.stage(stageId);
                List<CompletableFuture<StageResult>> upstream = new ArrayList<>();
                for (String dependency : graph.upstreamOf(stageId)) {
                    upstream.add(futures.get(dependency));
                }
                CompletableFuture<StageResult> future = CompletableFuture
                        .allOf(upstream.toArray(new CompletableFuture<?>[0]))
                        .thenApplyAsync(ignored -> executeStage(run, stage, joinAll(upstream)), workers);
                futures.put(stageId, future);
            }

            List<StageResult> results = new ArrayList<>();
            for (Map.Entry<String, CompletableFuture<StageResult>> entry : futures.entrySet()) {
                results.add(awaitResult(entry.getKey(), entry.getValue()));
            }
            PipelineStatus status = overallStatus(run, results);
            RunReport report = new RunReport(run.runId, definition.getName(), status, results, startedAt, Instant.now());
            log.info("run.end pipeline={} status={} succeeded={} failed={} cost={}",
                    definition.getName(), status, report.succeededStages(), report.failedStages(), report.totalCost());
            ledger.append(RunEvent.of(run.runId, "run.end", null, null, null, status.name()));
            return report;
        } finally {
            unregister.run();
            MdcContext.clear();
        }
    }

    private void storeSeeds(RunContext run) {
        for (SeedDefinition seed : run.definition.getSeeds()) {
            byte[] content = seed.getText() != null
                    ? seed.getText().getBytes(StandardCharsets.UTF_8)
                    : readSeedFile(run.definition.getBaseDir().resolve(seed.getPath()), seed.getId());
            String hash = store.putSeed(content, seed.getId());
            run.artifactHashes.put(seed.getId(), hash);
            log.debug("run.seed id={} hash={}", seed.getId(), hash);
        }
    }

    private byte[] readSeedFile(Path path, String seedId) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new IllegalArgumentException("Seed " + seedId + " cannot be read from " + path, e);
        }
    }

    private void resolveModels(RunContext run) {
        ModelHealthManager health = dispatcher.healthManager();
        for (String modelId : new LinkedHashSet<>(stageModels(run.definition))) {
            Recommendation recommendation = health.recommend(modelId);
            switch (recommendation.action()) {
                case PROCEED -> run.resolvedModels.put(modelId, modelId);
                case SUBSTITUTE -> {
                    String alternate = recommendation.substitute().id();
                    run.resolvedModels.put(modelId, alternate);
                    log.warn("run.model.substituted model={} substitute={} reason={}", modelId, alternate, recommendation.reason());
                    ledger.append(RunEvent.of(run.runId, "model.substituted", null, null, alternate,
                            modelId + " -> " + alternate + ": " + recommendation.reason()));
                }
                case CANCEL -> {
                    run.resolvedModels.put(modelId, modelId);
                    log.error("run.model.cancelled model={} reason={}", modelId, recommendation.reason());
                    ledger.append(RunEvent.of(run.runId, "model.cancelled", null, null, modelId, recommendation.reason()));
                }
            }
        }
    }

    private static List<String> stageModels(PipelineDefinition definition) {
        List<String> models = new ArrayList<>();
        for (StageDefinition stage : definition.getStages()) {
            models.add(stage.getModel());
        }
        return models;
    }

    private StageResult executeStage(RunContext run, StageDefinition stage, List<StageResult> upstream) {
        MdcContext.setStage(run.runId, stage.getId());
        WorkUnit unit = null;
        try {
            for (StageResult dependency : upstream) {
                if (!dependency.status().succeeded()) {
                    if (run.token.isCancelled()) {
                        return StageResult.cancelled(stage.getId(), null, 0, run.token.reason());
                    }
                    String reason = "upstream " + dependency.stageId() + " " + dependency.status();
                    log.warn("run.stage.skipped stage={} reason={}", stage.getId(), reason);
                    ledger.append(RunEvent.of(run.runId, "stage.skipped", stage.getId(), null, null, reason));
                    return StageResult.skipped(stage.getId(), reason);
                }
            }
            if (run.token.isCancelled()) {
                return StageResult.cancelled(stage.getId(), null, 0, run.token.reason());
            }

            List<String> inputHashes = new ArrayList<>();
            for (String input : stage.getInputs()) {
                inputHashes.add(run.artifactHashes.get(input));
            }
            PayloadSchema schema = schemaProvider.schemaFor(stage);
            Fingerprint fingerprint = fingerprints.compute(stage, inputHashes, schema, extractor.protocol());
            unit = new WorkUnit(stage.getId(), fingerprint, inputHashes, run.resolvedModels.get(stage.getModel()));
            unit.status(WorkUnitStatus.CACHE_CHECK);

            Optional<String> cached = store.has(fingerprint);
            if (cached.isPresent()) {
                return cachedResult(run, unit, cached.get(), "stage.cached");
            }

            WorkUnit work = unit;
            AtomicBoolean computedHere = new AtomicBoolean();
            String hash = store.computeIfAbsent(fingerprint, () -> {
                computedHere.set(true);
                return attempt(run, stage, work, schema);
            });
            if (!computedHere.get()) {
                return cachedResult(run, unit, hash, "stage.shared");
            }
            unit.status(WorkUnitStatus.DONE);
            run.artifactHashes.put(stage.getId(), hash);
            String outcome = store.find(hash).map(artifact -> artifact.metadata().extractionOutcome()).orElse("");
            log.info("run.stage.computed stage={} fingerprint={} artifact={} attempts={} model={} outcome={}",
                    stage.getId(), fingerprint.shortForm(), hash, unit.attemptCount(), unit.modelId(), outcome);
            ledger.append(RunEvent.of(run.runId, "stage.computed", stage.getId(), fingerprint.value(), unit.modelId(),
                    "artifact=" + hash + " attempts=" + unit.attemptCount() + " outcome=" + outcome));
            return new StageResult(stage.getId(), StageStatus.COMPUTED, fingerprint.value(), hash, unit.attemptCount(),
                    unit.modelId(), outcome, unit.cost(), null);
        } catch (StageFailureException e) {
            unit.status(WorkUnitStatus.FAILED);
            log.error("run.stage.failed stage={} fingerprint={} attempts={} inputs={} reason={}",
                    e.stageId(), e.fingerprint().shortForm(), e.attempts(), e.inputHashes(), e.getMessage());
            ledger.append(RunEvent.of(run.runId, "stage.failed", stage.getId(), e.fingerprint().value(), unit.modelId(),
                    e.getMessage()));
            return new StageResult(stage.getId(), StageStatus.FAILED, e.fingerprint().value(), null, e.attempts(),
                    unit.modelId(), "FAILED", unit.cost(), e.getMessage());
        } catch (CancellationException e) {
            if (unit != null) {
                unit.status(WorkUnitStatus.CANCELLED);
            }
            log.info("run.stage.cancelled stage={} reason={}", stage.getId(), e.getMessage());
            ledger.append(RunEvent.of(run.runId, "stage.cancelled", stage.getId(), null, null, e.getMessage()));
            return StageResult.cancelled(stage.getId(), unit == null ? null : unit.fingerprint().value(),
                    unit == null ? 0 : unit.attemptCount(), e.getMessage());
        } catch (StorageException e) {
            run.fatal.compareAndSet(null, e);
            run.token.cancel("storage failure: " + e.getMessage());
            log.error("run.stage.storage-failed stage={} reason={}", stage.getId(), e.getMessage(), e);
            ledger.append(RunEvent.of(run.runId, "stage.failed", stage.getId(), null, null, "storage: " + e.getMessage()));
            return failedResult(stage, unit, e);
        } catch (RuntimeException e) {
            log.error("run.stage.failed stage={} reason={}", stage.getId(), e.getMessage(), e);
            ledger.append(RunEvent.of(run.runId, "stage.failed", stage.getId(), null, null, e.getMessage()));
            return failedResult(stage, unit, e);
        } finally {
            MdcContext.clear();
        }
    }

    private StageResult cachedResult(RunContext run, WorkUnit unit, String hash, String event) {
        unit.status(WorkUnitStatus.DONE);
        run.artifactHashes.put(unit.stageId(), hash);
        String producer = store.provenanceOf(hash).map(ProvenanceRecord::producingModelId).orElse(null);
        log.info("run.{} stage={} fingerprint={} artifact={}", event, unit.stageId(), unit.fingerprint().shortForm(), hash);
        ledger.append(RunEvent.of(run.runId, event, unit.stageId(), unit.fingerprint().value(), producer, "artifact=" + hash));
        return new StageResult(unit.stageId(), StageStatus.CACHED, unit.fingerprint().value(), hash, 0, producer, "CACHED", 0.0, null);
    }

    private static StageResult failedResult(StageDefinition stage, WorkUnit unit, RuntimeException e) {
        if (unit != null) {
            unit.status(WorkUnitStatus.FAILED);
        }
        return new StageResult(stage.getId(), StageStatus.FAILED, unit == null ? null : unit.fingerprint().value(), null,
                unit == null ? 0 : unit.attemptCount(), unit == null ? null : unit.modelId(), "FAILED",
                unit == null ? 0.0 : unit.cost(), e.getMessage());
    }

    private PendingArtifact attempt(RunContext run, StageDefinition stage, WorkUnit unit, PayloadSchema schema) {
        Map<String, String> inputs = new LinkedHashMap<>();
        for (int i = 0; i < stage.getInputs().size(); i++) {
            inputs.put(stage.getInputs().get(i), new String(store.get(unit.inputHashes().get(i)), StandardCharsets.UTF_8));
        }
        String prompt = renderer.render(stage.getPrompt(), inputs, schema, extractor.protocol());
        ModelRequest request = new ModelRequest(prompt, stage.getMaxTokens(), stage.getTemperature());
        RetryPolicy policy = retryPolicy.withMaxAttempts(stage.getMaxAttempts());
        List<AttemptOutcome> history = new ArrayList<>();

        while (true) {
            run.token.throwIfCancelled();
            Recommendation recommendation = consultHealth(run, stage, unit);
            AttemptOutcome outcome;
            RuntimeException cause;
            double cost = 0.0;
            if (recommendation.action() == Recommendation.Action.CANCEL) {
                outcome = AttemptOutcome.cancelledByHealth(unit.modelId(), recommendation.reason());
                cause = null;
            } else {
                String modelId = unit.modelId();
                unit.status(WorkUnitStatus.DISPATCHING);
                DispatchOutcome dispatched = dispatcher.dispatch(modelId, request, history.size() + 1, run.token);
                if (dispatched.isSuccess()) {
                    cost = dispatched.cost();
                    unit.status(WorkUnitStatus.EXTRACTING);
                    ExtractionResult extraction = extractor.extract(dispatched.response().text(), schema, run.token);
                    outcome = AttemptOutcome.fromExtraction(modelId, extraction.outcome());
                    if (outcome.kind() == AttemptOutcome.Kind.SUCCESS) {
                        history.add(outcome);
                        unit.recordAttempt(outcome, cost);
                        ArtifactOrigin origin = ArtifactOrigin.stage(stage.getId(), unit.fingerprint(), unit.inputHashes(),
                                modelId, unit.cost(), extraction.outcome().kind().name());
                        return new PendingArtifact(serialize(extraction.payload()), origin);
                    }
                    cause = extraction.failureCause(schema);
                } else {
                    outcome = AttemptOutcome.fromDispatch(dispatched);
                    cause = dispatched.toException();
                }
            }
            history.add(outcome);
            unit.recordAttempt(outcome, cost);

            RetryDecision decision = policy.decide(history, random.getAsDouble());
            if (!decision.retry()) {
                throw new StageFailureException(stage.getId(), unit.fingerprint(), history.size(), unit.inputHashes(),
                        decision.reason(), cause);
            }
            log.warn("run.stage.retry stage={} attempt={} delayMs={} reason={}",
                    stage.getId(), history.size(), decision.delay().toMillis(), decision.reason());
            ledger.append(RunEvent.of(run.runId, "stage.retry", stage.getId(), unit.fingerprint().value(), outcome.modelId(),
                    "attempt=" + history.size() + " delayMs=" + decision.delay().toMillis() + " " + decision.reason()));
            unit.status(WorkUnitStatus.RETRYING);
            run.token.sleep(decision.delay());
        }
    }

    private Recommendation consultHealth(RunContext run, StageDefinition stage, WorkUnit unit) {
        String current = unit.modelId();
        Recommendation recommendation = dispatcher.healthManager().recommend(current);
        if (recommendation.action() == Recommendation.Action.SUBSTITUTE) {
            String alternate = recommendation.substitute().id();
            unit.modelId(alternate);
            log.warn("run.stage.substituted stage={} model={} substitute={}", stage.getId(), current, alternate);
            ledger.append(RunEvent.of(run.runId, "model.substituted", stage.getId(), unit.fingerprint().value(), alternate,
                    current + " -> " + alternate + ": " + recommendation.reason()));
        } else if (recommendation.action() == Recommendation.Action.CANCEL) {
            log.error("run.stage.model-cancelled stage={} model={} reason={}", stage.getId(), current, recommendation.reason());
        }
        return recommendation;
    }

    private byte[] serialize(JsonNode payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Extracted payload could not be serialized", e);
        }
    }

    private static List<StageResult> joinAll(List<CompletableFuture<StageResult>> futures) {
        List<StageResult> results = new ArrayList<>();
        for (CompletableFuture<StageResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private static StageResult awaitResult(String stageId, CompletableFuture<StageResult> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("run.stage.crashed stage={} reason={}", stageId, cause.getMessage(), cause);
            return new StageResult(stageId, StageStatus.FAILED, null, null, 0, null, "FAILED", 0.0, String.valueOf(cause.getMessage()));
        }
    }

    private static PipelineStatus overallStatus(RunContext run, List<StageResult> results) {
        if (run.userToken.isCancelled()) {
            return PipelineStatus.CANCELLED;
        }
        if (run.fatal.get() != null) {
            return PipelineStatus.FATAL_FAILURE;
        }
        long succeeded = results.stream().filter(result -> result.status().succeeded()).count();
        if (succeeded == results.size()) {
            return PipelineStatus.SUCCESS;
        }
        return succeeded > 0 ? PipelineStatus.PARTIAL_FAILURE : PipelineStatus.FATAL_FAILURE;
    }

    private static final class RunContext {
        private final String runId;
        private final PipelineDefinition definition;
        private final CancellationToken userToken;
        private final CancellationToken token = new CancellationToken();
        private final Map<String, String> artifactHashes = new ConcurrentHashMap<>();
        private final Map<String, String> resolvedModels = new ConcurrentHashMap<>();
        private final AtomicReference<StorageException> fatal = new AtomicReference<>();

        private RunContext(String runId, PipelineDefinition definition, CancellationToken userToken) {
            this.runId = runId;
            this.definition = definition;
            this.userToken = userToken;
        }
    }
}
