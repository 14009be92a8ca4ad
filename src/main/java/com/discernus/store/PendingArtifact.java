package com.discernus.store;

public record PendingArtifact(byte[] content, ArtifactOrigin origin) {
    public PendingArtifact {
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }
}
