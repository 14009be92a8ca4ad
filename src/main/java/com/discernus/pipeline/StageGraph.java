package com.discernus.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.discernus.pipeline.PipelineDefinition.StageDefinition;

/** Stage dependency graph. Seed ids are leaves and are not part of the ordering. */
public final class StageGraph {
    private final Map<String, List<String>> upstreamStages;
    private final Map<String, List<String>> downstreamStages;
    private final List<String> order;

    private StageGraph(Map<String, List<String>> upstreamStages, Map<String, List<String>> downstreamStages, List<String> order) {
        this.upstreamStages = upstreamStages;
        this.downstreamStages = downstreamStages;
        this.order = order;
    }

    public static StageGraph of(PipelineDefinition definition) {
        Map<String, List<String>> upstream = new LinkedHashMap<>();
        Map<String, List<String>> downstream = new LinkedHashMap<>();
        for (StageDefinition stage : definition.getStages()) {
            upstream.put(stage.getId(), new ArrayList<>());
            downstream.put(stage.getId(), new ArrayList<>());
        }
        for (StageDefinition stage : definition.getStages()) {
            for (String input : stage.getInputs()) {
                if (upstream.containsKey(input)) {
                    upstream.get(stage.getId()).add(input);
                    downstream.get(input).add(stage.getId());
                }
            }
        }

        // Kahn's algorithm; ties keep declaration order
        Map<String, Integer> pending = new LinkedHashMap<>();
        upstream.forEach((id, deps) -> pending.put(id, deps.size()));
        Deque<String> ready = new ArrayDeque<>();
        pending.forEach((id, count) -> {
            if (count == 0) {
                ready.add(id);
            }
        });
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : downstream.get(id)) {
                int remaining = pending.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }
        if (order.size() != upstream.size()) {
            List<String> cyclic = new ArrayList<>();
            pending.forEach((id, count) -> {
                if (count > 0) {
                    cyclic.add(id);
                }
            });
            throw new IllegalArgumentException("Pipeline " + definition.getName() + " has a dependency cycle among " + cyclic);
        }
        return new StageGraph(upstream, downstream, List.copyOf(order));
    }

    public List<String> topologicalOrder() {
        return order;
    }

    public List<String> upstreamOf(String stageId) {
        return List.copyOf(upstreamStages.getOrDefault(stageId, List.of()));
    }

    public List<String> downstreamOf(String stageId) {
        return List.copyOf(downstreamStages.getOrDefault(stageId, List.of()));
    }
}
