package com.discernus.health;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/** Counters over every recorded call outcome. */
public class DispatchStatistics {
    private final LongAdder successes = new LongAdder();
    private final Map<FailureClass, LongAdder> failures = new EnumMap<>(FailureClass.class);

    public DispatchStatistics() {
        for (FailureClass failureClass : FailureClass.values()) {
            failures.put(failureClass, new LongAdder());
        }
    }

    void record(CallOutcome outcome) {
        if (outcome.isSuccess()) {
            successes.increment();
        } else {
            failures.get(outcome.failureClass()).increment();
        }
    }

    public long successes() {
        return successes.sum();
    }

    public long failures(FailureClass failureClass) {
        return failures.get(failureClass).sum();
    }

    public long totalFailures() {
        long total = 0;
        for (LongAdder adder : failures.values()) {
            total += adder.sum();
        }
        return total;
    }

    public Map<FailureClass, Long> failureCounts() {
        Map<FailureClass, Long> counts = new EnumMap<>(FailureClass.class);
        failures.forEach((failureClass, adder) -> counts.put(failureClass, adder.sum()));
        return counts;
    }
}
