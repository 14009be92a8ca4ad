package com.discernus.pipeline;

import java.util.ArrayList;
import java.util.List;

import com.discernus.store.Fingerprint;

/** One stage execution within a run. */
public class WorkUnit {
    private final String stageId;
    private final Fingerprint fingerprint;
    private final List<String> inputHashes;
    private final List<AttemptOutcome> attempts = new ArrayList<>();
    private volatile WorkUnitStatus status = WorkUnitStatus.PENDING;
    private volatile String modelId;
    private double cost;

    public WorkUnit(String stageId, Fingerprint fingerprint, List<String> inputHashes, String modelId) {
        this.stageId = stageId;
        this.fingerprint = fingerprint;
        this.inputHashes = List.copyOf(inputHashes);
        this.modelId = modelId;
    }

    public String stageId() {
        return stageId;
    }

    public Fingerprint fingerprint() {
        return fingerprint;
    }

    public List<String> inputHashes() {
        return inputHashes;
    }

    public WorkUnitStatus status() {
        return status;
    }

    void status(WorkUnitStatus status) {
        this.status = status;
    }

    public String modelId() {
        return modelId;
    }

    void modelId(String modelId) {
        this.modelId = modelId;
    }

    public synchronized List<AttemptOutcome> attempts() {
        return List.copyOf(attempts);
    }

    public synchronized int attemptCount() {
        return attempts.size();
    }

    synchronized void recordAttempt(AttemptOutcome outcome, double attemptCost) {
        attempts.add(outcome);
        cost += attemptCost;
    }

    public synchronized double cost() {
        return cost;
    }
}
