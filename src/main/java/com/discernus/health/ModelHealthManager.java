package com.discernus.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks per-model health from call outcomes and advises the orchestrator on
 * whether to proceed, substitute or cancel. Recommendations are advisory.
 */
public class ModelHealthManager {
    private static final Logger log = LoggerFactory.getLogger(ModelHealthManager.class);

    private final ModelRegistry registry;
    private final HealthThresholds thresholds;
    private final Map<String, DispatchStrategy> strategies = new LinkedHashMap<>();
    private final Map<String, ModelHealth> health = new LinkedHashMap<>();
    private final DispatchStatistics statistics = new DispatchStatistics();
    private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();

    public ModelHealthManager(ModelRegistry registry, HealthThresholds thresholds, DispatchStrategies strategyFactory) {
        this.registry = registry;
        this.thresholds = thresholds;
        for (ModelDescriptor descriptor : registry.all()) {
            strategies.put(descriptor.id(), strategyFactory.forModel(descriptor));
            health.put(descriptor.id(), new ModelHealth(descriptor.id()));
        }
    }

    public ModelRegistry registry() {
        return registry;
    }

    public void addListener(HealthListener listener) {
        listeners.add(listener);
    }

    public DispatchStrategy selectDispatchStrategy(String modelId) {
        DispatchStrategy strategy = strategies.get(modelId);
        if (strategy == null) {
            throw new IllegalArgumentException("Unknown model: " + modelId);
        }
        return strategy;
    }

    public HealthTransition recordOutcome(String modelId, CallOutcome outcome) {
        ModelHealth modelHealth = healthFor(modelId);
        statistics.record(outcome);
        HealthTransition transition = modelHealth.record(outcome, thresholds);
        if (transition.changed()) {
            log.info("health.transition model={} from={} to={} consecutiveFailures={} cause={}",
                    modelId, transition.previous(), transition.current(), transition.consecutiveFailures(), transition.cause());
        }
        for (HealthListener listener : listeners) {
            listener.onTransition(transition);
        }
        return transition;
    }

    public Recommendation recommend(String modelId) {
        ModelDescriptor descriptor = registry.require(modelId);
        HealthState state = healthFor(modelId).state();
        if (state != HealthState.UNAVAILABLE) {
            return Recommendation.proceed(modelId);
        }
        ModelDescriptor degradedCandidate = null;
        for (ModelDescriptor candidate : registry.all()) {
            if (candidate.id().equals(modelId) || !candidate.capability().equals(descriptor.capability())) {
                continue;
            }
            HealthState candidateState = healthFor(candidate.id()).state();
            if (candidateState == HealthState.HEALTHY) {
                return Recommendation.substitute(modelId, candidate, modelId + " unavailable; " + candidate.id() + " is healthy");
            }
            if (candidateState == HealthState.DEGRADED && degradedCandidate == null) {
                degradedCandidate = candidate;
            }
        }
        if (degradedCandidate != null) {
            return Recommendation.substitute(modelId, degradedCandidate,
                    modelId + " unavailable; " + degradedCandidate.id() + " is degraded but reachable");
        }
        return Recommendation.cancel(modelId, "no available model with capability " + descriptor.capability());
    }

    public HealthState healthOf(String modelId) {
        return healthFor(modelId).state();
    }

    public List<ModelStatus> snapshot() {
        List<ModelStatus> statuses = new ArrayList<>();
        for (ModelDescriptor descriptor : registry.all()) {
            ModelHealth modelHealth = health.get(descriptor.id());
            statuses.add(new ModelStatus(descriptor, modelHealth.state(), modelHealth.consecutiveFailures()));
        }
        return statuses;
    }

    public DispatchStatistics statistics() {
        return statistics;
    }

    private ModelHealth healthFor(String modelId) {
        ModelHealth modelHealth = health.get(modelId);
        if (modelHealth == null) {
            throw new IllegalArgumentException("Unknown model: " + modelId);
        }
        return modelHealth;
    }
}
