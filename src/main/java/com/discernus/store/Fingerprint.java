package com.discernus.store;

/**
 * Cache key of one stage execution: a hash over the stage id, its ordered input
 * artifact hashes and its canonical configuration. Equal fingerprints are expected
 * to produce interchangeable artifacts.
 */
public record Fingerprint(String value) {
    public Fingerprint {
        if (!Hashing.isContentHash(value)) {
            throw new IllegalArgumentException("Fingerprint must be a lowercase SHA-256 hex string: " + value);
        }
    }

    public String shortForm() {
        return value.substring(0, 12);
    }

    @Override
    public String toString() {
        return value;
    }
}
