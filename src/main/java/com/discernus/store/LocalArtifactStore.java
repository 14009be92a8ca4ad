package com.discernus.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Filesystem artifact store. Layout under the root directory:
 * <ul>
 * <li>{@code artifacts/{hash}.bin} content and {@code artifacts/{hash}.meta.json} sidecar metadata</li>
 * <li>{@code provenance.jsonl} append-only provenance log</li>
 * <li>{@code fingerprints.jsonl} append-only fingerprint index</li>
 * </ul>
 * Artifact files are written to a temp file and renamed into place, so a reader
 * never observes a partial artifact. Only the index and provenance appends are
 * serialized; lookups read the in-memory maps without locking.
 */
public class LocalArtifactStore implements ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(LocalArtifactStore.class);
    private static final String TEMP_PREFIX = ".tmp-";
    private static final String CONTENT_SUFFIX = ".bin";
    private static final String METADATA_SUFFIX = ".meta.json";

    private final Path root;
    private final Path artifactsDir;
    private final Path provenanceLog;
    private final Path fingerprintLog;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Map<String, String> fingerprintIndex = new ConcurrentHashMap<>();
    private final Map<String, ProvenanceRecord> provenance = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();
    private final Object indexWriteLock = new Object();

    private LocalArtifactStore(Path root) {
        this.root = root;
        this.artifactsDir = root.resolve("artifacts");
        this.provenanceLog = root.resolve("provenance.jsonl");
        this.fingerprintLog = root.resolve("fingerprints.jsonl");
    }

    public static LocalArtifactStore open(Path root) {
        LocalArtifactStore store = new LocalArtifactStore(root);
        try {
            Files.createDirectories(store.artifactsDir);
            store.removeStrayTempFiles();
            terminateTornLine(store.provenanceLog);
            terminateTornLine(store.fingerprintLog);
            store.loadProvenance();
            store.loadFingerprintIndex();
        } catch (IOException e) {
            throw new StorageException("Unable to open artifact store at " + root.toAbsolutePath().normalize(), e);
        }
        log.info("store.opened root={} fingerprints={} provenanceRecords={}",
                root, store.fingerprintIndex.size(), store.provenance.size());
        return store;
    }

    public Path root() {
        return root;
    }

    @Override
    public String put(byte[] content, ArtifactOrigin origin) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(origin, "origin");
        String hash = Hashing.sha256Hex(content);
        Path contentPath = contentPath(hash);
        try {
            if (Files.exists(contentPath)) {
                log.debug("store.put.dedupe hash={} label={}", hash, origin.label());
            } else {
                ArtifactMetadata metadata = new ArtifactMetadata(
                        Instant.now(),
                        origin.stageId(),
                        origin.inputHashes(),
                        origin.modelId(),
                        origin.cost(),
                        content.length,
                        origin.extractionOutcome(),
                        origin.label());
                writeAtomically(metadataPath(hash), mapper.writeValueAsBytes(metadata));
                writeAtomically(contentPath, content);
                log.debug("store.put.committed hash={} bytes={} label={}", hash, content.length, origin.label());
            }
        } catch (IOException e) {
            throw new StorageException("Unable to write artifact " + hash, e);
        }

        if (!origin.isSeed()) {
            synchronized (indexWriteLock) {
                if (!provenance.containsKey(hash)) {
                    appendProvenance(new ProvenanceRecord(
                            hash,
                            origin.fingerprint().value(),
                            origin.stageId(),
                            origin.inputHashes(),
                            origin.modelId(),
                            Instant.now()));
                }
                bindFingerprint(origin.fingerprint(), hash);
            }
        }
        return hash;
    }

    @Override
    public byte[] get(String contentHash) {
        if (!Hashing.isContentHash(contentHash)) {
            throw new ArtifactNotFoundException(contentHash);
        }
        Path contentPath = contentPath(contentHash);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(contentPath);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(contentHash);
        } catch (IOException e) {
            throw new StorageException("Unable to read artifact " + contentHash, e);
        }
        if (!Hashing.sha256Hex(bytes).equals(contentHash)) {
            throw new StorageException("Artifact content does not match its hash: " + contentHash);
        }
        return bytes;
    }

    @Override
    public Optional<Artifact> find(String contentHash) {
        if (!Hashing.isContentHash(contentHash) || !Files.exists(contentPath(contentHash))) {
            return Optional.empty();
        }
        byte[] content = get(contentHash);
        ArtifactMetadata metadata;
        try {
            metadata = mapper.readValue(metadataPath(contentHash).toFile(), ArtifactMetadata.class);
        } catch (IOException e) {
            log.warn("store.metadata.unreadable hash={} reason={}", contentHash, e.getMessage());
            metadata = new ArtifactMetadata(null, null, List.of(), null, 0.0, content.length, null, null);
        }
        return Optional.of(new Artifact(contentHash, content, metadata));
    }

    @Override
    public Optional<String> has(Fingerprint fingerprint) {
        return Optional.ofNullable(fingerprintIndex.get(fingerprint.value()));
    }

    @Override
    public void recordProvenance(ProvenanceRecord record) {
        Objects.requireNonNull(record, "record");
        if (!Files.exists(contentPath(record.artifactHash()))) {
            throw new ArtifactNotFoundException(record.artifactHash());
        }
        synchronized (indexWriteLock) {
            if (provenance.containsKey(record.artifactHash())) {
                throw new IllegalStateException("Provenance already recorded for artifact " + record.artifactHash());
            }
            appendProvenance(record);
        }
    }

    @Override
    public String computeIfAbsent(Fingerprint fingerprint, ArtifactComputation computation) {
        while (true) {
            String cached = fingerprintIndex.get(fingerprint.value());
            if (cached != null) {
                return cached;
            }
            CompletableFuture<String> claim = new CompletableFuture<>();
            CompletableFuture<String> existing = inFlight.putIfAbsent(fingerprint.value(), claim);
            if (existing == null) {
                return runClaimed(fingerprint, computation, claim);
            }
            log.debug("store.compute.await fingerprint={}", fingerprint.shortForm());
            try {
                return existing.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for fingerprint " + fingerprint.shortForm());
            } catch (CancellationException e) {
                log.debug("store.compute.owner-cancelled fingerprint={}", fingerprint.shortForm());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (!(cause instanceof CancellationException)) {
                    if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    throw new StorageException("Computation failed for fingerprint " + fingerprint, cause);
                }
                log.debug("store.compute.owner-cancelled fingerprint={}", fingerprint.shortForm());
            }
        }
    }

    private String runClaimed(Fingerprint fingerprint, ArtifactComputation computation, CompletableFuture<String> claim) {
        try {
            String cached = fingerprintIndex.get(fingerprint.value());
            if (cached != null) {
                claim.complete(cached);
                return cached;
            }
            PendingArtifact pending = computation.compute();
            ArtifactOrigin origin = pending.origin();
            if (origin.isSeed() || !fingerprint.equals(origin.fingerprint())) {
                throw new IllegalStateException("Computation for " + fingerprint + " produced an artifact with a different origin");
            }
            String hash = put(pending.content(), origin);
            claim.complete(hash);
            return hash;
        } catch (RuntimeException | Error e) {
            claim.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint.value(), claim);
        }
    }

    @Override
    public Optional<ProvenanceRecord> provenanceOf(String artifactHash) {
        return Optional.ofNullable(provenance.get(artifactHash));
    }

    @Override
    public List<ProvenanceRecord> trace(String artifactHash) {
        List<ProvenanceRecord> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(artifactHash);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            ProvenanceRecord record = provenance.get(current);
            if (record == null) {
                continue;
            }
            chain.add(record);
            queue.addAll(record.upstreamArtifactHashes());
        }
        return chain;
    }

    @Override
    public IntegrityReport verify() {
        List<String> corrupt = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> dangling = new ArrayList<>();
        int checked = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(artifactsDir, "*" + CONTENT_SUFFIX)) {
            for (Path path : stream) {
                String fileName = path.getFileName().toString();
                String expected = fileName.substring(0, fileName.length() - CONTENT_SUFFIX.length());
                checked++;
                if (!Hashing.sha256Hex(Files.readAllBytes(path)).equals(expected)) {
                    corrupt.add(expected);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Unable to scan artifacts under " + artifactsDir, e);
        }
        fingerprintIndex.values().stream()
                .distinct()
                .filter(hash -> !Files.exists(contentPath(hash)))
                .forEach(missing::add);
        for (ProvenanceRecord record : provenance.values()) {
            for (String upstream : record.upstreamArtifactHashes()) {
                if (!Files.exists(contentPath(upstream))) {
                    dangling.add(record.artifactHash() + "->" + upstream);
                }
            }
        }
        IntegrityReport report = new IntegrityReport(checked, corrupt, missing, dangling);
        log.info("store.verify checked={} corrupt={} missing={} dangling={}",
                checked, corrupt.size(), missing.size(), dangling.size());
        return report;
    }

    private void bindFingerprint(Fingerprint fingerprint, String hash) {
        String bound = fingerprintIndex.get(fingerprint.value());
        if (hash.equals(bound)) {
            return;
        }
        if (bound != null) {
            log.warn("store.fingerprint.conflict fingerprint={} bound={} rejected={}", fingerprint.shortForm(), bound, hash);
            return;
        }
        appendLine(fingerprintLog, new FingerprintEntry(fingerprint.value(), hash, Instant.now()));
        fingerprintIndex.put(fingerprint.value(), hash);
    }

    private void appendProvenance(ProvenanceRecord record) {
        ensureAcyclic(record);
        appendLine(provenanceLog, record);
        provenance.put(record.artifactHash(), record);
    }

    private void ensureAcyclic(ProvenanceRecord record) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(record.upstreamArtifactHashes());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(record.artifactHash())) {
                throw new IllegalArgumentException("Provenance for " + record.artifactHash() + " would form a cycle");
            }
            if (!visited.add(current)) {
                continue;
            }
            ProvenanceRecord upstream = provenance.get(current);
            if (upstream != null) {
                queue.addAll(upstream.upstreamArtifactHashes());
            }
        }
    }

    private void appendLine(Path logPath, Object entry) {
        try {
            String line = mapper.writeValueAsString(entry) + System.lineSeparator();
            Files.writeString(logPath, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageException("Unable to append to " + logPath.getFileName(), e);
        }
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), TEMP_PREFIX, ".part");
        try {
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /** Ends a torn last line so the next append starts on a fresh line. */
    private static void terminateTornLine(Path logPath) throws IOException {
        if (!Files.exists(logPath) || Files.size(logPath) == 0) {
            return;
        }
        byte[] bytes = Files.readAllBytes(logPath);
        if (bytes[bytes.length - 1] != '\n') {
            Files.writeString(logPath, System.lineSeparator(), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        }
    }

    private void removeStrayTempFiles() throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(artifactsDir, TEMP_PREFIX + "*")) {
            for (Path path : stream) {
                log.warn("store.temp.removed path={}", path.getFileName());
                Files.deleteIfExists(path);
            }
        }
    }

    private void loadProvenance() throws IOException {
        for (ProvenanceRecord record : readJsonLines(provenanceLog, ProvenanceRecord.class)) {
            provenance.putIfAbsent(record.artifactHash(), record);
        }
    }

    private void loadFingerprintIndex() throws IOException {
        for (FingerprintEntry entry : readJsonLines(fingerprintLog, FingerprintEntry.class)) {
            if (!Files.exists(contentPath(entry.artifactHash()))) {
                log.warn("store.fingerprint.dropped fingerprint={} missingArtifact={}", entry.fingerprint(), entry.artifactHash());
                continue;
            }
            fingerprintIndex.putIfAbsent(entry.fingerprint(), entry.artifactHash());
        }
    }

    private <T> List<T> readJsonLines(Path path, Class<T> type) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        List<T> entries = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                entries.add(mapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                // a crash mid-append leaves at most one torn line at the tail
                log.warn("store.log.skipped file={} line={} reason={}", path.getFileName(), i + 1, e.getOriginalMessage());
            }
        }
        return entries;
    }

    private Path contentPath(String hash) {
        return artifactsDir.resolve(hash + CONTENT_SUFFIX);
    }

    private Path metadataPath(String hash) {
        return artifactsDir.resolve(hash + METADATA_SUFFIX);
    }

    public record FingerprintEntry(String fingerprint, String artifactHash, Instant boundAt) {
    }
}
