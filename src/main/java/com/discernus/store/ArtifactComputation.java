package com.discernus.store;

@FunctionalInterface
public interface ArtifactComputation {
    PendingArtifact compute();
}
