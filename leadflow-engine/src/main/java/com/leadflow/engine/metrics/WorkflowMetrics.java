package com.leadflow.engine.metrics;

import com.leadflow.core.model.ExecutionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow engine.
 * 
 * Metrics exposed:
 * - Execution counts by status
 * - Execution lifecycle counters
 * - Step dispatch latency by action kind and outcome
 * - Retry and skip counts
 * - Trigger and rule evaluation outcomes
 * - Segment recalculation changes
 * - Stuck executions
 * 
 * Meters are recorded to the global registry until {@link #bindTo} is called.
 */
@Component
public class WorkflowMetrics implements MeterBinder {

    // Metric names
    public static final String EXECUTION_COUNT = "leadflow.executions";
    public static final String EXECUTION_STARTED = "leadflow.executions.started";
    public static final String EXECUTION_COMPLETED = "leadflow.executions.completed";
    public static final String EXECUTION_FAILED = "leadflow.executions.failed";
    public static final String EXECUTION_CANCELLED = "leadflow.executions.cancelled";
    public static final String EXECUTION_PAUSED = "leadflow.executions.paused";
    public static final String EXECUTION_RESUMED = "leadflow.executions.resumed";
    public static final String EXECUTION_DURATION = "leadflow.execution.duration";
    
    public static final String STEP_DURATION = "leadflow.step.duration";
    public static final String STEP_RETRIES = "leadflow.step.retries";
    public static final String STEP_SKIPS = "leadflow.step.skips";
    public static final String STEP_DISCARDED = "leadflow.step.discarded";
    
    public static final String TRIGGER_EVALUATIONS = "leadflow.trigger.evaluations";
    public static final String RULE_ERRORS = "leadflow.rule.errors";
    
    public static final String SEGMENT_CHANGES = "leadflow.segment.changes";
    public static final String SEGMENT_FAILURES = "leadflow.segment.failures";
    
    public static final String STUCK_EXECUTIONS = "leadflow.executions.stuck";
    public static final String WAKES_IGNORED = "leadflow.wakes.ignored";

    private volatile MeterRegistry registry = Metrics.globalRegistry;
    
    private final Map<ExecutionStatus, AtomicInteger> statusGauges = new EnumMap<>(ExecutionStatus.class);

    public WorkflowMetrics() {
        for (ExecutionStatus status : ExecutionStatus.values()) {
            statusGauges.put(status, new AtomicInteger(0));
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        
        for (Map.Entry<ExecutionStatus, AtomicInteger> entry : statusGauges.entrySet()) {
            Gauge.builder(EXECUTION_COUNT, entry.getValue(), AtomicInteger::get)
                .tag("status", entry.getKey().name())
                .description("Number of executions in " + entry.getKey() + " status")
                .register(registry);
        }
    }

    // ========== Execution Metrics ==========

    public void executionStarted(String workflowId) {
        Counter.builder(EXECUTION_STARTED)
            .tag("workflow", workflowId)
            .description("Total executions started")
            .register(registry)
            .increment();
    }

    public void executionCompleted(String workflowId, Duration duration) {
        Counter.builder(EXECUTION_COMPLETED)
            .tag("workflow", workflowId)
            .description("Total executions completed")
            .register(registry)
            .increment();
        
        Timer.builder(EXECUTION_DURATION)
            .tag("workflow", workflowId)
            .description("Time from execution start to completion")
            .register(registry)
            .record(duration);
    }

    public void executionFailed(String workflowId, String errorCode) {
        Counter.builder(EXECUTION_FAILED)
            .tag("workflow", workflowId)
            .tag("error_code", sanitize(errorCode))
            .description("Total executions failed")
            .register(registry)
            .increment();
    }

    public void executionCancelled(String workflowId) {
        Counter.builder(EXECUTION_CANCELLED)
            .tag("workflow", workflowId)
            .description("Total executions cancelled")
            .register(registry)
            .increment();
    }

    public void executionPaused(String workflowId) {
        Counter.builder(EXECUTION_PAUSED)
            .tag("workflow", workflowId)
            .description("Total executions paused")
            .register(registry)
            .increment();
    }

    public void executionResumed(String workflowId) {
        Counter.builder(EXECUTION_RESUMED)
            .tag("workflow", workflowId)
            .description("Total executions resumed")
            .register(registry)
            .increment();
    }

    // ========== Step Metrics ==========

    public void stepDispatched(String actionKind, String outcome, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("action", actionKind)
            .tag("outcome", outcome)
            .description("Action handler execution time")
            .register(registry)
            .record(duration);
    }

    public void stepRetried(String workflowId, String actionKind) {
        Counter.builder(STEP_RETRIES)
            .tag("workflow", workflowId)
            .tag("action", actionKind)
            .description("Total step retries scheduled")
            .register(registry)
            .increment();
    }

    public void stepSkipped(String workflowId, String actionKind) {
        Counter.builder(STEP_SKIPS)
            .tag("workflow", workflowId)
            .tag("action", actionKind)
            .description("Total steps skipped by their guard")
            .register(registry)
            .increment();
    }

    public void stepResultDiscarded(String workflowId) {
        Counter.builder(STEP_DISCARDED)
            .tag("workflow", workflowId)
            .description("Step results dropped because the execution changed concurrently")
            .register(registry)
            .increment();
    }

    public void wakeIgnored(String reason) {
        Counter.builder(WAKES_IGNORED)
            .tag("reason", reason)
            .description("Wakes delivered for executions that were not waiting")
            .register(registry)
            .increment();
    }

    // ========== Trigger and Rule Metrics ==========

    public void triggerEvaluated(String triggerKind, String outcome) {
        Counter.builder(TRIGGER_EVALUATIONS)
            .tag("trigger", triggerKind)
            .tag("outcome", outcome)
            .description("Workflow entry evaluations by outcome")
            .register(registry)
            .increment();
    }

    public void ruleEvaluationError(String scope) {
        Counter.builder(RULE_ERRORS)
            .tag("scope", scope)
            .description("Rule evaluations that could not be completed")
            .register(registry)
            .increment();
    }

    // ========== Segment Metrics ==========

    public void segmentRecalculated(String segmentId, int added, int removed, int failures) {
        Counter.builder(SEGMENT_CHANGES)
            .tag("segment", segmentId)
            .tag("change", "added")
            .description("Segment membership changes")
            .register(registry)
            .increment(added);
        Counter.builder(SEGMENT_CHANGES)
            .tag("segment", segmentId)
            .tag("change", "removed")
            .description("Segment membership changes")
            .register(registry)
            .increment(removed);
        Counter.builder(SEGMENT_FAILURES)
            .tag("segment", segmentId)
            .description("Entities that could not be evaluated during recalculation")
            .register(registry)
            .increment(failures);
    }

    // ========== Recovery Metrics ==========

    public void stuckExecutionDetected(String workflowId) {
        Counter.builder(STUCK_EXECUTIONS)
            .tag("workflow", workflowId)
            .description("Waiting executions found past their wake time")
            .register(registry)
            .increment();
    }

    // ========== Helper Methods ==========

    /**
     * Update status gauges from store state (for accuracy after restart).
     */
    public void syncStatusGauges(Map<ExecutionStatus, Long> counts) {
        for (Map.Entry<ExecutionStatus, AtomicInteger> entry : statusGauges.entrySet()) {
            entry.getValue().set(counts.getOrDefault(entry.getKey(), 0L).intValue());
        }
    }

    public int statusGauge(ExecutionStatus status) {
        return statusGauges.get(status).get();
    }

    /**
     * Sanitize a free-form value for use as a metric tag.
     */
    private String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "unspecified";
        }
        String sanitized = value.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9_]", "_")
            .replaceAll("_+", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
