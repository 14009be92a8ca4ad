package com.discernus.store;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the provenance log, consumed by report renderers that cite the
 * artifacts a result was derived from.
 */
public interface ProvenanceReader {
    Optional<ProvenanceRecord> provenanceOf(String artifactHash);

    /**
     * Walks the chain upstream from {@code artifactHash}, breadth first, and returns
     * every provenance record reached. Artifacts without a record are seeds.
     */
    List<ProvenanceRecord> trace(String artifactHash);
}
