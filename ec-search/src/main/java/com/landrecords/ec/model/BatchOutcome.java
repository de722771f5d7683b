package com.landrecords.ec.model;

import java.util.List;

/**
 * Summary of a finished batch run: one outcome per target in list order.
 */
public record BatchOutcome(String runId, List<TargetOutcome> outcomes, boolean sessionExpired, boolean cancelled) {

    public BatchOutcome {
        outcomes = List.copyOf(outcomes);
    }

    public int total() {
        return outcomes.size();
    }

    public int attempted() {
        return (int) outcomes.stream().filter(TargetOutcome::attempted).count();
    }

    public int rowsFound() {
        return outcomes.stream().mapToInt(TargetOutcome::rowsFound).sum();
    }

    public List<TargetOutcome> errors() {
        return outcomes.stream().filter(TargetOutcome::isError).toList();
    }

    public boolean terminatedEarly() {
        return sessionExpired || cancelled;
    }
}
