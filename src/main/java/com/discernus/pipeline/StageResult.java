package com.discernus.pipeline;

public record StageResult(
        String stageId,
        StageStatus status,
        String fingerprint,
        String artifactHash,
        int attempts,
        String modelId,
        String outcome,
        double cost,
        String error) {

    static StageResult skipped(String stageId, String reason) {
        return new StageResult(stageId, StageStatus.SKIPPED, null, null, 0, null, "", 0.0, reason);
    }

    static StageResult cancelled(String stageId, String fingerprint, int attempts, String reason) {
        return new StageResult(stageId, StageStatus.CANCELLED, fingerprint, null, attempts, null, "", 0.0, reason);
    }
}
