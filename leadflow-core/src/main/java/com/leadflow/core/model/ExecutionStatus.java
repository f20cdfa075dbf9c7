package com.leadflow.core.model;

/**
 * Lifecycle states for a workflow execution.
 */
public enum ExecutionStatus {
    /**
     * A step is being dispatched.
     * Transitions: -> RUNNING (next step), WAITING, PAUSED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Suspended until a scheduled wake: the delay after a step, or the
     * backoff before a retry.
     * Transitions: -> RUNNING, PAUSED, FAILED, CANCELLED
     */
    WAITING,

    /**
     * Halted by an explicit pause command.
     * Transitions: -> RUNNING, WAITING (pending wake not yet due), FAILED, CANCELLED
     */
    PAUSED,

    /**
     * All steps finished. Terminal state.
     */
    COMPLETED,

    /**
     * A step failed fatally or exhausted its retries. Terminal state.
     */
    FAILED,

    /**
     * Cancelled by request. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this status is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this status counts towards the one-active-execution limit.
     */
    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case RUNNING -> target == RUNNING || target == WAITING || target == PAUSED ||
                           target == COMPLETED || target == FAILED || target == CANCELLED;
            case WAITING -> target == RUNNING || target == PAUSED ||
                           target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == WAITING ||
                          target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
