package com.leadflow.core.model;

/**
 * Recorded result of a finished step.
 */
public enum StepOutcome {
    SUCCEEDED,
    SKIPPED
}
