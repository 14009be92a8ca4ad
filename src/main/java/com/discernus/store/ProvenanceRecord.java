package com.discernus.store;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvenanceRecord(
        String artifactHash,
        String producingFingerprint,
        String producerStageId,
        List<String> upstreamArtifactHashes,
        String producingModelId,
        Instant recordedAt) {

    public ProvenanceRecord {
        upstreamArtifactHashes = upstreamArtifactHashes == null ? List.of() : List.copyOf(upstreamArtifactHashes);
    }
}
