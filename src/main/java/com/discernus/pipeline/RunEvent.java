package com.discernus.pipeline;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RunEvent(
        Instant timestamp,
        String runId,
        String event,
        String stageId,
        String fingerprint,
        String modelId,
        String detail) {

    public static RunEvent of(String runId, String event, String stageId, String fingerprint, String modelId, String detail) {
        return new RunEvent(Instant.now(), runId, event, stageId, fingerprint, modelId, detail);
    }
}
