package com.discernus.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record RunReport(
        String runId,
        String pipelineName,
        PipelineStatus status,
        List<StageResult> stages,
        Instant startedAt,
        Instant finishedAt) {

    public RunReport {
        stages = List.copyOf(stages);
    }

    public Optional<StageResult> stage(String stageId) {
        return stages.stream().filter(result -> result.stageId().equals(stageId)).findFirst();
    }

    public List<String> succeededStages() {
        List<String> ids = new ArrayList<>();
        for (StageResult result : stages) {
            if (result.status().succeeded()) {
                ids.add(result.stageId());
            }
        }
        return ids;
    }

    public List<String> failedStages() {
        List<String> ids = new ArrayList<>();
        for (StageResult result : stages) {
            if (result.status() == StageStatus.FAILED) {
                ids.add(result.stageId());
            }
        }
        return ids;
    }

    public double totalCost() {
        double total = 0.0;
        for (StageResult result : stages) {
            total += result.cost();
        }
        return total;
    }
}
