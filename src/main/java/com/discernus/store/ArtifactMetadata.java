package com.discernus.store;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactMetadata(
        Instant timestamp,
        String producerStageId,
        List<String> inputHashes,
        String modelId,
        double cost,
        long byteSize,
        String extractionOutcome,
        String label) {

    public ArtifactMetadata {
        inputHashes = inputHashes == null ? List.of() : List.copyOf(inputHashes);
    }

    public boolean seed() {
        return producerStageId == null;
    }
}
