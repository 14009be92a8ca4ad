package com.discernus.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.discernus.dispatch.CancellationToken;
import com.discernus.dispatch.ModelCallException;
import com.discernus.dispatch.ModelClient;
import com.discernus.dispatch.ModelDispatcher;
import com.discernus.dispatch.ModelRequest;
import com.discernus.dispatch.ModelResponse;
import com.discernus.dispatch.SecondaryExtractionClient;
import com.discernus.gasket.GasketExtractor;
import com.discernus.gasket.MarkerProtocol;
import com.discernus.gasket.MultipleBlockPolicy;
import com.discernus.health.BackoffPolicy;
import com.discernus.health.CallOutcome;
import com.discernus.health.DispatchStrategies;
import com.discernus.health.FailureClass;
import com.discernus.health.HealthState;
import com.discernus.health.HealthThresholds;
import com.discernus.health.HealthTransition;
import com.discernus.health.ModelDescriptor;
import com.discernus.health.ModelHealthManager;
import com.discernus.health.ModelRegistry;
import com.discernus.health.Sleeper;
import com.discernus.health.Ticker;
import com.discernus.pipeline.PipelineDefinition.SchemaDefinition;
import com.discernus.pipeline.PipelineDefinition.SeedDefinition;
import com.discernus.pipeline.PipelineDefinition.StageDefinition;
import com.discernus.store.Artifact;
import com.discernus.store.ArtifactComputation;
import com.discernus.store.ArtifactOrigin;
import com.discernus.store.ArtifactStore;
import com.discernus.store.Fingerprint;
import com.discernus.store.IntegrityReport;
import com.discernus.store.LocalArtifactStore;
import com.discernus.store.PendingArtifact;
import com.discernus.store.ProvenanceRecord;
import com.discernus.store.StorageException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineOrchestratorTest {
    private static final BackoffPolicy FAST_BACKOFF = new BackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(5), 0.0);
    private static final String GOOD_PAYLOAD = MarkerProtocol.DEFAULT.wrap("{\"score\":0.7,\"evidence\":\"quote\"}");

    @TempDir
    Path tempDir;

    private final ExecutorService workers = Executors.newFixedThreadPool(8);
    private final List<ModelDispatcher> dispatchers = new ArrayList<>();
    private LocalArtifactStore store;
    private RunLedger ledger;

    @BeforeEach
    void setUp() {
        store = LocalArtifactStore.open(tempDir.resolve("store"));
        ledger = new RunLedger(tempDir.resolve("ledger.jsonl"));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        dispatchers.forEach(ModelDispatcher::close);
    }

    @Test
    void shouldRetryCapacityFailuresAndReportHealthTransitions() {
        ScriptedClient client = new ScriptedClient();
        client.failFirst("shared-a", 2, FailureClass.CAPACITY_EXHAUSTED);
        ModelHealthManager health = healthManager(ModelDescriptor.dynamicShared("shared-a", "p", "flagship"));
        List<HealthTransition> transitions = new CopyOnWriteArrayList<>();
        health.addListener(transitions::add);

        RunReport report = orchestrator(health, client).run(singleStage("shared-a", null), new CancellationToken());

        StageResult analysis = report.stage("analysis").orElseThrow();
        assertEquals(PipelineStatus.SUCCESS, report.status());
        assertEquals(StageStatus.COMPUTED, analysis.status());
        assertEquals(3, analysis.attempts());
        assertEquals(2, transitions.stream().filter(t -> t.current() == HealthState.DEGRADED).count());
        assertEquals(1, transitions.stream().filter(HealthTransition::isReset).count());
        assertEquals(HealthState.HEALTHY, health.healthOf("shared-a"));
    }

    @Test
    void shouldSubstituteHealthyModelAfterRepeatedFailures() throws Exception {
        ScriptedClient client = new ScriptedClient();
        client.failFirst("a", 100, FailureClass.CAPACITY_EXHAUSTED);
        ModelHealthManager health = healthManager(
                ModelDescriptor.dynamicShared("a", "p", "flagship"),
                ModelDescriptor.dynamicShared("b", "p", "flagship"));

        RunReport report = orchestrator(health, client).run(singleStage("a", 6), new CancellationToken());

        StageResult analysis = report.stage("analysis").orElseThrow();
        assertEquals(StageStatus.COMPUTED, analysis.status());
        assertEquals("b", analysis.modelId());
        assertEquals(6, analysis.attempts());
        assertEquals(5, client.calls("a"));
        assertEquals(1, client.calls("b"));
        ProvenanceRecord record = store.provenanceOf(analysis.artifactHash()).orElseThrow();
        assertEquals("b", record.producingModelId());
        assertTrue(ledger.eventsFor(report.runId()).stream()
                .anyMatch(event -> event.event().equals("model.substituted") && "b".equals(event.modelId())));
    }

    @Test
    void shouldKeepConfiguredModelInFingerprintWhenSubstitutedBeforeRun() throws Exception {
        ScriptedClient client = new ScriptedClient();
        ModelHealthManager health = healthManager(
                ModelDescriptor.dynamicShared("a", "p", "flagship"),
                ModelDescriptor.dynamicShared("b", "p", "flagship"));
        health.recordOutcome("a", CallOutcome.failure(FailureClass.AUTHENTICATION, "revoked"));
        PipelineDefinition definition = singleStage("a", null);

        RunReport report = orchestrator(health, client).run(definition, new CancellationToken());

        StageResult analysis = report.stage("analysis").orElseThrow();
        assertEquals("b", analysis.modelId());
        assertEquals(0, client.calls("a"));
        String seedHash = store.provenanceOf(analysis.artifactHash()).orElseThrow().upstreamArtifactHashes().get(0);
        String expected = new FingerprintCalculator().compute(definition.stage("analysis"), List.of(seedHash),
                definition.stage("analysis").declaredSchema(), MarkerProtocol.DEFAULT).value();
        assertEquals(expected, analysis.fingerprint());
        assertTrue(ledger.eventsFor(report.runId()).stream()
                .anyMatch(event -> event.event().equals("model.substituted") && event.stageId() == null));
    }

    @Test
    void shouldResumeFromStoredArtifactsWithoutCallingModels() {
        ScriptedClient client = new ScriptedClient();
        ModelHealthManager health = healthManager(ModelDescriptor.dynamicShared("m", "p", "flagship"));
        PipelineOrchestrator orchestrator = orchestrator(health, client);

        RunReport first = orchestrator.run(chain("m"), new CancellationToken());
        int callsAfterFirst = client.totalCalls();
        RunReport second = orchestrator.run(chain("m"), new CancellationToken());

        assertEquals(PipelineStatus.SUCCESS, first.status());
        assertEquals(2, callsAfterFirst);
        assertEquals(2, client.totalCalls());
        assertEquals(PipelineStatus.SUCCESS, second.status());
        for (StageResult result : second.stages()) {
            assertEquals(StageStatus.CACHED, result.status());
            assertEquals(first.stage(result.stageId()).orElseThrow().artifactHash(), result.artifactHash());
        }
        assertEquals(0.0, second.totalCost());
    }

    @Test
    void shouldDispatchOnceForConcurrentRunsOfSamePipeline() throws Exception {
        ScriptedClient client = new ScriptedClient();
        client.delay(Duration.ofMillis(200));
        ModelHealthManager health = healthManager(ModelDescriptor.dynamicShared("m", "p", "flagship"));
        PipelineOrchestrator orchestrator = orchestrator(health, client);
        ExecutorService runners = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<RunReport>> runs = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                runs.add(runners.submit(() -> {
                    start.await();
                    return orchestrator.run(singleStage("m", null), new CancellationToken());
                }));
            }
            start.countDown();

            List<String> hashes = new ArrayList<>();
            for (Future<RunReport> run : runs) {
                RunReport report = run.get();
                assertEquals(PipelineStatus.SUCCESS, report.status());
                hashes.add(report.stage("analysis").orElseThrow().artifactHash());
            }
            assertEquals(1, client.totalCalls());
            assertEquals(1, hashes.stream().distinct().count());
        } finally {
            runners.shutdownNow();
        }
    }

    @Test
    void shouldSkipDependentsOfFailedStageAndFinishIndependentBranch() throws Exception {
        ScriptedClient client = new ScriptedClient();
        client.failFirst("bad", 100, FailureClass.AUTHENTICATION);
        ModelHealthManager health = healthManager(
                ModelDescriptor.dynamicShared("bad", "p", "x"),
                ModelDescriptor.dynamicShared("good", "p", "y"));
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName("branches");
        definition.setSeeds(List.of(new SeedDefinition("doc", null, "text")));
        definition.setStages(List.of(
                stage("left", "bad", List.of("doc")),
                stage("dependent", "good", List.of("left")),
                stage("right", "good", List.of("doc"))));

        RunReport report = orchestrator(health, client).run(definition, new CancellationToken());

        assertEquals(PipelineStatus.PARTIAL_FAILURE, report.status());
        assertEquals(StageStatus.FAILED, report.stage("left").orElseThrow().status());
        assertEquals(1, report.stage("left").orElseThrow().attempts());
        assertEquals(StageStatus.SKIPPED, report.stage("dependent").orElseThrow().status());
        assertEquals(StageStatus.COMPUTED, report.stage("right").orElseThrow().status());
        assertEquals(List.of("left"), report.failedStages());
        assertTrue(ledger.eventsFor(report.runId()).stream().anyMatch(event -> event.event().equals("stage.skipped")));
        assertEquals(3, PipelineStatus.PARTIAL_FAILURE.exitCode());
    }

    @Test
    void shouldNotRetrySchemaViolation() {
        ScriptedClient client = new ScriptedClient();
        client.respondWith(MarkerProtocol.DEFAULT.wrap("{\"other\":1}"));
        ModelHealthManager health = healthManager(ModelDescriptor.dynamicShared("m", "p", "flagship"));

        RunReport report = orchestrator(health, client).run(singleStage("m", 5), new CancellationToken());

        StageResult analysis = report.stage("analysis").orElseThrow();
        assertEquals(StageStatus.FAILED, analysis.status());
        assertEquals(1, analysis.attempts());
        assertEquals(1, client.totalCalls());
        assertNull(analysis.artifactHash());
        assertEquals(PipelineStatus.FATAL_FAILURE, report.status());
        assertTrue(store.has(new Fingerprint(analysis.fingerprint())).isEmpty());
    }

    @Test
    void shouldRetryMalformedOutput() {
        ScriptedClient client = new ScriptedClient();
        client.respondWith("I am unable to produce JSON today.", GOOD_PAYLOAD);
        ModelHealthManager health = healthManager(ModelDescriptor.dynamicShared("m", "p", "flagship"));

        RunReport report = orchestrator(health, client).run(singleStage("m", null), new CancellationToken());

        StageResult analysis = report.stage("analysis").orElseThrow();
        assertEquals(StageStatus.COMPUTED, analysis.status());
        assertEquals(2, analysis.attempts());
        assertEquals("CLEAN", analysis.outcome());
    }

    @Test
    void shouldStopAndMarkRunCancelledWhenUserCancels() {
        CancellationToken token = new CancellationToken();
        ScriptedClient client = new ScriptedClient();
        client.onCall(() -> token.cancel("user interrupt"));
        client.delay(Duration.ofSeconds(5));
        ModelHealthManager health = healthManager(ModelDescriptor.dynamicShared("m", "p", "flagship"));

        RunReport report = orchestrator(health, client).run(chain("m"), token);

        assertEquals(PipelineStatus.CANCELLED, report.status());
        assertEquals(5, report.status().exitCode());
        assertEquals(StageStatus.CANCELLED, report.stage("analysis").orElseThrow().status());
        assertEquals(StageStatus.CANCELLED, report.stage("synthesis").orElseThrow().status());
        assertFalse(report.stage("analysis").orElseThrow().status().succeeded());
        assertEquals(1, client.totalCalls());
    }

    @Test
    void shouldCancelSecondaryExtractionCallWhenUserCancels() {
        CancellationToken token = new CancellationToken();
        AtomicInteger helperCalls = new AtomicInteger();
        ModelClient client = (model, request) -> {
            if (!model.id().equals("helper")) {
                return new ModelResponse("I could not format the answer, sorry.", 100, 20);
            }
            helperCalls.incrementAndGet();
            token.cancel("user interrupt");
            try {
                Thread.sleep(4_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ModelCallException(FailureClass.NETWORK, "interrupted");
            }
            return new ModelResponse(GOOD_PAYLOAD, 100, 20);
        };
        ModelHealthManager health = healthManager(
                ModelDescriptor.dynamicShared("m", "p", "flagship"),
                ModelDescriptor.dynamicShared("helper", "p", "small"));
        ModelDispatcher dispatcher = dispatcher(health, client);
        GasketExtractor extractor = new GasketExtractor(MarkerProtocol.DEFAULT, MultipleBlockPolicy.LAST,
                new SecondaryExtractionClient(dispatcher, "helper"));

        long started = System.nanoTime();
        RunReport report = orchestrator(dispatcher, extractor, store).run(singleStage("m", null), token);
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(PipelineStatus.CANCELLED, report.status());
        assertEquals(StageStatus.CANCELLED, report.stage("analysis").orElseThrow().status());
        assertEquals(1, helperCalls.get());
        assertTrue(elapsedMs < 2_000, "run took " + elapsedMs + "ms");
    }

    @Test
    void shouldAbortOnStorageFailureAndResumeFromIntactArtifacts() throws IOException {
        ScriptedClient client = new ScriptedClient();
        ModelHealthManager health = healthManager(ModelDescriptor.dynamicShared("m", "p", "flagship"));
        FailingWriteStore failingStore = new FailingWriteStore(store, "synthesis");

        RunReport failed = orchestrator(dispatcher(health, client), new GasketExtractor(), failingStore)
                .run(chain("m"), new CancellationToken());

        assertEquals(PipelineStatus.FATAL_FAILURE, failed.status());
        assertEquals(4, failed.status().exitCode());
        StageResult analysis = failed.stage("analysis").orElseThrow();
        assertEquals(StageStatus.COMPUTED, analysis.status());
        assertEquals(StageStatus.FAILED, failed.stage("synthesis").orElseThrow().status());
        assertTrue(failed.stage("synthesis").orElseThrow().error().contains("disk full"));
        assertEquals(2, client.totalCalls());
        assertTrue(ledger.eventsFor(failed.runId()).stream()
                .anyMatch(event -> event.event().equals("stage.failed") && "synthesis".equals(event.stageId())));

        IntegrityReport integrity = store.verify();
        assertTrue(integrity.clean());
        assertEquals(analysis.artifactHash(), store.provenanceOf(analysis.artifactHash()).orElseThrow().artifactHash());

        RunReport resumed = orchestrator(health, client).run(chain("m"), new CancellationToken());

        assertEquals(PipelineStatus.SUCCESS, resumed.status());
        assertEquals(StageStatus.CACHED, resumed.stage("analysis").orElseThrow().status());
        assertEquals(analysis.artifactHash(), resumed.stage("analysis").orElseThrow().artifactHash());
        assertEquals(StageStatus.COMPUTED, resumed.stage("synthesis").orElseThrow().status());
        assertEquals(3, client.totalCalls());
    }

    private ModelHealthManager healthManager(ModelDescriptor... models) {
        return new ModelHealthManager(
                new ModelRegistry(List.of(models)),
                HealthThresholds.DEFAULT,
                new DispatchStrategies(FAST_BACKOFF, Ticker.SYSTEM, Sleeper.SYSTEM, () -> 0.0));
    }

    private ModelDispatcher dispatcher(ModelHealthManager health, ModelClient client) {
        ModelDispatcher dispatcher = new ModelDispatcher(health, client);
        dispatchers.add(dispatcher);
        return dispatcher;
    }

    private PipelineOrchestrator orchestrator(ModelHealthManager health, ModelClient client) {
        return orchestrator(dispatcher(health, client), new GasketExtractor(), store);
    }

    private PipelineOrchestrator orchestrator(ModelDispatcher dispatcher, GasketExtractor extractor, ArtifactStore artifacts) {
        return new PipelineOrchestrator(
                artifacts,
                dispatcher,
                extractor,
                new RetryPolicy(3, FAST_BACKOFF),
                ledger,
                workers,
                SchemaProvider.DECLARED,
                () -> 0.0);
    }

    private static PipelineDefinition singleStage(String model, Integer maxAttempts) {
        StageDefinition analysis = stage("analysis", model, List.of("doc"));
        analysis.setMaxAttempts(maxAttempts);
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName("single");
        definition.setSeeds(List.of(new SeedDefinition("doc", null, "We hold these truths to be self-evident.")));
        definition.setStages(List.of(analysis));
        return definition;
    }

    private static PipelineDefinition chain(String model) {
        PipelineDefinition definition = new PipelineDefinition();
        definition.setName("chain");
        definition.setSeeds(List.of(new SeedDefinition("doc", null, "Ask not what your country can do for you.")));
        definition.setStages(List.of(
                stage("analysis", model, List.of("doc")),
                stage("synthesis", model, List.of("analysis"))));
        return definition;
    }

    private static StageDefinition stage(String id, String model, List<String> inputs) {
        return new StageDefinition(id, model, inputs, "Score the text.\n{{" + inputs.get(0) + "}}",
                new SchemaDefinition(id, List.of("score", "evidence")));
    }

    private static final class ScriptedClient implements ModelClient {
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        private final Map<String, Integer> failuresRemaining = new ConcurrentHashMap<>();
        private final Map<String, FailureClass> failureClasses = new ConcurrentHashMap<>();
        private final AtomicInteger total = new AtomicInteger();
        private volatile List<String> responses = List.of(GOOD_PAYLOAD);
        private volatile Duration delay = Duration.ZERO;
        private volatile Runnable onCall = () -> { };

        void failFirst(String model, int count, FailureClass failureClass) {
            failuresRemaining.put(model, count);
            failureClasses.put(model, failureClass);
        }

        void respondWith(String... texts) {
            responses = List.of(texts);
        }

        void delay(Duration value) {
            delay = value;
        }

        void onCall(Runnable action) {
            onCall = action;
        }

        int calls(String model) {
            AtomicInteger count = calls.get(model);
            return count == null ? 0 : count.get();
        }

        int totalCalls() {
            return total.get();
        }

        @Override
        public ModelResponse complete(ModelDescriptor model, ModelRequest request) {
            int call = total.incrementAndGet();
            calls.computeIfAbsent(model.id(), ignored -> new AtomicInteger()).incrementAndGet();
            onCall.run();
            if (!delay.isZero()) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ModelCallException(FailureClass.NETWORK, "interrupted");
                }
            }
            Integer remaining = failuresRemaining.get(model.id());
            if (remaining != null && remaining > 0) {
                failuresRemaining.put(model.id(), remaining - 1);
                throw new ModelCallException(failureClasses.get(model.id()), "scripted failure");
            }
            List<String> texts = responses;
            String text = texts.get(Math.min(call, texts.size()) - 1);
            return new ModelResponse(text, 100, 20);
        }
    }

    /** Delegates to a real store but fails to persist the output of one stage. */
    private static final class FailingWriteStore implements ArtifactStore {
        private final ArtifactStore delegate;
        private final String failingStage;

        FailingWriteStore(ArtifactStore delegate, String failingStage) {
            this.delegate = delegate;
            this.failingStage = failingStage;
        }

        @Override
        public String computeIfAbsent(Fingerprint fingerprint, ArtifactComputation computation) {
            return delegate.computeIfAbsent(fingerprint, () -> {
                PendingArtifact pending = computation.compute();
                if (failingStage.equals(pending.origin().stageId())) {
                    throw new StorageException("disk full writing " + failingStage, new IOException("No space left on device"));
                }
                return pending;
            });
        }

        @Override
        public String put(byte[] content, ArtifactOrigin origin) {
            return delegate.put(content, origin);
        }

        @Override
        public byte[] get(String contentHash) {
            return delegate.get(contentHash);
        }

        @Override
        public Optional<Artifact> find(String contentHash) {
            return delegate.find(contentHash);
        }

        @Override
        public Optional<String> has(Fingerprint fingerprint) {
            return delegate.has(fingerprint);
        }

        @Override
        public void recordProvenance(ProvenanceRecord record) {
            delegate.recordProvenance(record);
        }

        @Override
        public IntegrityReport verify() {
            return delegate.verify();
        }

        @Override
        public Optional<ProvenanceRecord> provenanceOf(String artifactHash) {
            return delegate.provenanceOf(artifactHash);
        }

        @Override
        public List<ProvenanceRecord> trace(String artifactHash) {
            return delegate.trace(artifactHash);
        }
    }
}
