package com.discernus.store;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Immutable, content-addressed result of one computation stage (or a seed input).
 * Two artifacts with the same {@code contentHash} are interchangeable.
 */
public record Artifact(String contentHash, byte[] content, ArtifactMetadata metadata) {

    public Artifact {
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String producerStageId() {
        return metadata.producerStageId();
    }

    public List<String> inputHashes() {
        return metadata.inputHashes();
    }

    public String contentAsText() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
