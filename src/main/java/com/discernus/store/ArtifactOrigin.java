package com.discernus.store;

import java.util.List;

/**
 * Describes how a piece of content came to be: the producing stage and fingerprint,
 * the upstream artifacts it was derived from and the model that produced it. Seeds
 * carry only a label.
 */
public record ArtifactOrigin(
        String stageId,
        Fingerprint fingerprint,
        List<String> inputHashes,
        String modelId,
        double cost,
        String extractionOutcome,
        String label) {

    public ArtifactOrigin {
        inputHashes = inputHashes == null ? List.of() : List.copyOf(inputHashes);
        if (stageId != null && fingerprint == null) {
            throw new IllegalArgumentException("Stage output " + stageId + " requires a producing fingerprint");
        }
    }

    public static ArtifactOrigin seed(String label) {
        return new ArtifactOrigin(null, null, List.of(), null, 0.0, null, label);
    }

    public static ArtifactOrigin stage(
            String stageId,
            Fingerprint fingerprint,
            List<String> inputHashes,
            String modelId,
            double cost,
            String extractionOutcome) {
        return new ArtifactOrigin(stageId, fingerprint, inputHashes, modelId, cost, extractionOutcome, stageId);
    }

    public boolean isSeed() {
        return stageId == null;
    }
}
