package com.leadflow.core.model;

import java.time.Instant;

/**
 * Result of one finished step, kept in the execution's history.
 * The step index may only advance past an index that has a record.
 */
public record StepRecord(
    int index,
    String actionKind,
    StepOutcome outcome,
    int attempts,
    Instant recordedAt
) {
    public static StepRecord succeeded(StepDefinition step, int attempts, Instant at) {
        return new StepRecord(step.index(), step.actionKind(), StepOutcome.SUCCEEDED, attempts, at);
    }

    public static StepRecord skipped(StepDefinition step, Instant at) {
        return new StepRecord(step.index(), step.actionKind(), StepOutcome.SKIPPED, 0, at);
    }
}
