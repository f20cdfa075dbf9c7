package com.leadflow.core.model;

/**
 * Types of events in an execution's audit log.
 */
public enum ExecutionEventType {
    // Execution lifecycle
    EXECUTION_CREATED,
    EXECUTION_WAITING,
    EXECUTION_WOKEN,
    EXECUTION_PAUSED,
    EXECUTION_RESUMED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    EXECUTION_CANCELLED,

    // Steps
    STEP_DISPATCHED,
    STEP_SUCCEEDED,
    STEP_SKIPPED,
    STEP_FAILED,
    STEP_RETRY_SCHEDULED,
    STEP_RESULT_DISCARDED,

    // Timers
    WAKE_IGNORED,

    // Monitoring
    EXECUTION_STUCK
}
