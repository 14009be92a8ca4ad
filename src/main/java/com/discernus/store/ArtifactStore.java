package com.discernus.store;

import java.util.Optional;

/**
 * Content-addressable persistence of every computation result. The store is the
 * single source of truth for whether a fingerprint has already been computed.
 */
public interface ArtifactStore extends ProvenanceReader {

    /**
     * Stores {@code content} and returns its content hash. Storing identical bytes
     * again returns the same hash without duplicating storage. The first put of a
     * stage output appends its provenance record and binds its fingerprint.
     */
    String put(byte[] content, ArtifactOrigin origin);

    default String putSeed(byte[] content, String label) {
        return put(content, ArtifactOrigin.seed(label));
    }

    byte[] get(String contentHash);

    Optional<Artifact> find(String contentHash);

    Optional<String> has(Fingerprint fingerprint);

    void recordProvenance(ProvenanceRecord record);

    /**
     * Returns the artifact bound to {@code fingerprint}, running {@code computation}
     * when none is bound yet. At most one computation per fingerprint runs at a time;
     * concurrent callers wait for it and reuse its result.
     */
    String computeIfAbsent(Fingerprint fingerprint, ArtifactComputation computation);

    IntegrityReport verify();
}
