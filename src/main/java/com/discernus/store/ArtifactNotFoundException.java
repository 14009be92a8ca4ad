package com.discernus.store;

public class ArtifactNotFoundException extends StorageException {
    private final String artifactHash;

    public ArtifactNotFoundException(String artifactHash) {
        super("Artifact not found: " + artifactHash);
        this.artifactHash = artifactHash;
    }

    public String artifactHash() {
        return artifactHash;
    }
}
