package com.leadflow.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the execution, workflow and entity they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(executionId, workflowId, entityId, stepIndex, attempt)) {
 *     log.info("Dispatching step"); // Automatically includes executionId, stepIndex, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [leadflow-timer] INFO  c.l.e.c.ExecutionStateMachine - Dispatching step
 *   executionId=5f2c... workflowId=welcome:v2 entityId=lead-42 stepIndex=1 attempt=1
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String ENTITY_ID = "entityId";
    public static final String STEP_INDEX = "stepIndex";
    public static final String ATTEMPT = "attempt";
    public static final String SEGMENT_ID = "segmentId";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous;

    private LoggingContext() {
        this.previous = MDC.getCopyOfContextMap();
    }

    /**
     * Create a logging context for execution-level operations.
     */
    public static LoggingContext forExecution(UUID executionId, String workflowId, String entityId) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            MDC.put(EXECUTION_ID, executionId.toString());
        }
        putIfPresent(WORKFLOW_ID, workflowId);
        putIfPresent(ENTITY_ID, entityId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one step attempt.
     */
    public static LoggingContext forStep(UUID executionId, String workflowId, String entityId,
                                         int stepIndex, int attempt) {
        LoggingContext ctx = forExecution(executionId, workflowId, entityId);
        MDC.put(STEP_INDEX, String.valueOf(stepIndex));
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Create a logging context for trigger handling, before any execution exists.
     */
    public static LoggingContext forEntity(String entityId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(ENTITY_ID, entityId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for segment recalculation.
     */
    public static LoggingContext forSegment(String segmentId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(SEGMENT_ID, segmentId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current execution ID from context.
     */
    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    /**
     * Restore the context that was in place when this one was opened, so
     * contexts can nest. A trace ID created inside is kept.
     */
    @Override
    public void close() {
        String traceId = MDC.get(TRACE_ID);
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
        if (traceId != null && MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, traceId);
        }
    }

    /**
     * Clear all MDC context. Call at the end of a request or background loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
