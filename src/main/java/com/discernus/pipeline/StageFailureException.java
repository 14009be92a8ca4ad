package com.discernus.pipeline;

import java.util.List;

import com.discernus.store.Fingerprint;

/** A stage that could not produce its artifact, with enough context to find its inputs again. */
public class StageFailureException extends RuntimeException {
    private final String stageId;
    private final Fingerprint fingerprint;
    private final int attempts;
    private final List<String> inputHashes;

    public StageFailureException(String stageId, Fingerprint fingerprint, int attempts, List<String> inputHashes,
            String message, Throwable cause) {
        super("Stage " + stageId + " failed after " + attempts + " attempt(s) [fingerprint=" + fingerprint.shortForm()
                + "]: " + message, cause);
        this.stageId = stageId;
        this.fingerprint = fingerprint;
        this.attempts = attempts;
        this.inputHashes = List.copyOf(inputHashes);
    }

    public String stageId() {
        return stageId;
    }

    public Fingerprint fingerprint() {
        return fingerprint;
    }

    public int attempts() {
        return attempts;
    }

    public List<String> inputHashes() {
        return inputHashes;
    }
}
