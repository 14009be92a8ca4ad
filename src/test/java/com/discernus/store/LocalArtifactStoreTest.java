package com.discernus.store;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalArtifactStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStoreIdenticalContentOnce() throws Exception {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        byte[] content = "same bytes".getBytes(StandardCharsets.UTF_8);

        String first = store.putSeed(content, "a");
        String second = store.putSeed(content, "b");

        assertEquals(first, second);
        assertEquals(Hashing.sha256Hex(content), first);
        assertArrayEquals(content, store.get(first));
        try (var files = Files.list(tempDir.resolve("artifacts"))) {
            assertEquals(1, files.filter(path -> path.toString().endsWith(".bin")).count());
        }
    }

    @Test
    void shouldBindFingerprintAndRecordSingleProvenanceRecord() {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        String seed = store.putSeed(bytes("source document"), "doc");
        Fingerprint fingerprint = fingerprint("analysis");

        String hash = store.put(bytes("{\"score\":1}"), ArtifactOrigin.stage("analysis", fingerprint, List.of(seed), "model-a", 0.01, "CLEAN"));
        store.put(bytes("{\"score\":1}"), ArtifactOrigin.stage("analysis", fingerprint, List.of(seed), "model-a", 0.01, "CLEAN"));

        assertEquals(hash, store.has(fingerprint).orElseThrow());
        ProvenanceRecord record = store.provenanceOf(hash).orElseThrow();
        assertEquals("analysis", record.producerStageId());
        assertEquals(List.of(seed), record.upstreamArtifactHashes());
        assertEquals("model-a", record.producingModelId());
        assertEquals(fingerprint.value(), record.producingFingerprint());
        assertTrue(store.provenanceOf(seed).isEmpty());
    }

    @Test
    void shouldKeepFirstBindingWhenFingerprintProducesDifferentContent() {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        Fingerprint fingerprint = fingerprint("flaky");

        String first = store.put(bytes("one"), ArtifactOrigin.stage("flaky", fingerprint, List.of(), "m", 0.0, "CLEAN"));
        store.put(bytes("two"), ArtifactOrigin.stage("flaky", fingerprint, List.of(), "m", 0.0, "CLEAN"));

        assertEquals(first, store.has(fingerprint).orElseThrow());
    }

    @Test
    void shouldReloadIndexAndProvenanceAfterReopen() {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        String seed = store.putSeed(bytes("seed"), "seed");
        Fingerprint fingerprint = fingerprint("stage");
        String hash = store.put(bytes("result"), ArtifactOrigin.stage("stage", fingerprint, List.of(seed), "m", 0.0, "CLEAN"));

        LocalArtifactStore reopened = LocalArtifactStore.open(tempDir);

        assertEquals(hash, reopened.has(fingerprint).orElseThrow());
        assertEquals("stage", reopened.provenanceOf(hash).orElseThrow().producerStageId());
        assertEquals("stage", reopened.find(hash).orElseThrow().metadata().producerStageId());
    }

    @Test
    void shouldSkipTornLogLineOnOpen() throws Exception {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        Fingerprint fingerprint = fingerprint("stage");
        String hash = store.put(bytes("result"), ArtifactOrigin.stage("stage", fingerprint, List.of(), "m", 0.0, "CLEAN"));
        Files.writeString(tempDir.resolve("provenance.jsonl"), "{\"artifactHash\":\"abc", StandardOpenOption.APPEND);
        Files.writeString(tempDir.resolve("artifacts").resolve(".tmp-crashed.part"), "partial");

        LocalArtifactStore reopened = LocalArtifactStore.open(tempDir);

        assertTrue(reopened.provenanceOf(hash).isPresent());
        assertFalse(Files.exists(tempDir.resolve("artifacts").resolve(".tmp-crashed.part")));
    }

    @Test
    void shouldRunComputationOnceForConcurrentCallers() throws Exception {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        Fingerprint fingerprint = fingerprint("expensive");
        AtomicInteger computations = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.computeIfAbsent(fingerprint, () -> {
                        computations.incrementAndGet();
                        sleep(100);
                        return new PendingArtifact(bytes("computed"),
                                ArtifactOrigin.stage("expensive", fingerprint, List.of(), "m", 0.0, "CLEAN"));
                    });
                }));
            }
            start.countDown();
            String expected = Hashing.sha256Hex(bytes("computed"));
            for (Future<String> result : results) {
                assertEquals(expected, result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, computations.get());
    }

    @Test
    void shouldAllowRecomputeAfterFailedComputation() {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        Fingerprint fingerprint = fingerprint("retry");

        assertThrows(IllegalStateException.class, () -> store.computeIfAbsent(fingerprint, () -> {
            throw new IllegalStateException("model down");
        }));
        assertTrue(store.has(fingerprint).isEmpty());

        String hash = store.computeIfAbsent(fingerprint, () -> new PendingArtifact(bytes("ok"),
                ArtifactOrigin.stage("retry", fingerprint, List.of(), "m", 0.0, "CLEAN")));
        assertEquals(hash, store.has(fingerprint).orElseThrow());
    }

    @Test
    void shouldTraceChainBackToSeeds() {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        String seed = store.putSeed(bytes("doc"), "doc");
        String analysis = store.put(bytes("analysis"),
                ArtifactOrigin.stage("analysis", fingerprint("analysis"), List.of(seed), "m", 0.0, "CLEAN"));
        String synthesis = store.put(bytes("synthesis"),
                ArtifactOrigin.stage("synthesis", fingerprint("synthesis"), List.of(analysis), "m", 0.0, "CLEAN"));

        List<ProvenanceRecord> chain = store.trace(synthesis);

        assertEquals(2, chain.size());
        assertEquals("synthesis", chain.get(0).producerStageId());
        assertEquals("analysis", chain.get(1).producerStageId());
        assertEquals(List.of(seed), chain.get(1).upstreamArtifactHashes());
    }

    @Test
    void shouldDetectCorruptedContent() throws Exception {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);
        String hash = store.putSeed(bytes("original"), "doc");
        Files.writeString(tempDir.resolve("artifacts").resolve(hash + ".bin"), "tampered");

        IntegrityReport report = store.verify();

        assertFalse(report.clean());
        assertEquals(List.of(hash), report.corruptArtifacts());
        assertThrows(StorageException.class, () -> store.get(hash));
    }

    @Test
    void shouldRejectMalformedHashes() {
        LocalArtifactStore store = LocalArtifactStore.open(tempDir);

        assertThrows(ArtifactNotFoundException.class, () -> store.get("../../etc/passwd"));
        assertTrue(store.find("not-a-hash").isEmpty());
    }

    private static Fingerprint fingerprint(String seed) {
        return new Fingerprint(Hashing.sha256Hex("fingerprint:" + seed));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
