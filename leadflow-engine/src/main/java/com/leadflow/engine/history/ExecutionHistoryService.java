package com.leadflow.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.model.ExecutionEventType;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.repository.ExecutionEventRepository;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the execution log.
 *
 * Provides:
 * - Full event history of one execution
 * - Per-step timelines
 * - Workflow statistics over a time window
 */
public class ExecutionHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistoryService.class);

    private static final int SUMMARY_LENGTH = 200;

    private final ExecutionEventRepository eventRepository;
    private final ExecutionInstanceRepository instanceRepository;
    private final Clock clock;

    public ExecutionHistoryService(ExecutionEventRepository eventRepository,
                                   ExecutionInstanceRepository instanceRepository,
                                   Clock clock) {
        this.eventRepository = eventRepository;
        this.instanceRepository = instanceRepository;
        this.clock = clock;
    }

    /**
     * Get full history for an execution.
     */
    public ExecutionHistory getHistory(UUID executionId) {
        ExecutionInstance instance = instanceRepository.findById(executionId)
            .orElseThrow(() -> new NotFoundException("ExecutionInstance", executionId.toString()));

        List<ExecutionEvent> events = eventRepository.findByExecution(executionId);

        return new ExecutionHistory(
            executionId,
            instance.workflowId(),
            instance.entityId(),
            instance.status(),
            events,
            buildTimeline(events),
            buildStepHistory(events),
            calculateStatistics(events, instance)
        );
    }

    /**
     * Timeline of an execution's events in sequence order.
     */
    public List<TimelineEntry> timeline(UUID executionId) {
        return buildTimeline(eventRepository.findByExecution(executionId));
    }

    /**
     * Statistics over the executions of a workflow version created within
     * the given window before now.
     */
    public WorkflowStats workflowStats(String workflowId, Duration window) {
        Instant since = clock.instant().minus(window);
        List<ExecutionInstance> executions = instanceRepository.findByWorkflow(workflowId, since);

        Map<ExecutionStatus, Long> byStatus = new EnumMap<>(ExecutionStatus.class);
        for (ExecutionStatus status : ExecutionStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (ExecutionInstance execution : executions) {
            byStatus.merge(execution.status(), 1L, Long::sum);
        }

        long total = executions.size();
        long completed = byStatus.get(ExecutionStatus.COMPLETED);
        long failed = byStatus.get(ExecutionStatus.FAILED);

        Duration averageCompletionTime = executions.stream()
            .filter(e -> e.status() == ExecutionStatus.COMPLETED && e.completedAt() != null)
            .map(e -> Duration.between(e.createdAt(), e.completedAt()))
            .reduce(Duration.ZERO, Duration::plus)
            .dividedBy(Math.max(completed, 1));

        log.debug("Stats for {} since {}: {} executions", workflowId, since, total);
        return new WorkflowStats(
            workflowId,
            since,
            total,
            byStatus,
            rate(completed, total),
            rate(failed, total),
            averageCompletionTime
        );
    }

    // ========== Internal Methods ==========

    private List<TimelineEntry> buildTimeline(List<ExecutionEvent> events) {
        return events.stream()
            .map(e -> new TimelineEntry(
                e.timestamp(),
                e.sequenceNumber(),
                e.type().name(),
                e.stepIndex(),
                e.actorType(),
                summarizePayload(e.payload())
            ))
            .collect(Collectors.toList());
    }

    /**
     * Group step events by step index.
     */
    private Map<Integer, StepHistory> buildStepHistory(List<ExecutionEvent> events) {
        Map<Integer, List<ExecutionEvent>> byStep = new TreeMap<>();
        for (ExecutionEvent event : events) {
            if (event.isStepEvent() && event.stepIndex() != null) {
                byStep.computeIfAbsent(event.stepIndex(), k -> new ArrayList<>()).add(event);
            }
        }

        Map<Integer, StepHistory> history = new TreeMap<>();
        byStep.forEach((index, stepEvents) -> history.put(index, new StepHistory(
            index,
            actionKind(stepEvents),
            stepEvents.stream().filter(e -> e.type() == ExecutionEventType.STEP_DISPATCHED).count(),
            lastOutcome(stepEvents),
            stepDuration(stepEvents)
        )));
        return history;
    }

    private ExecutionStatistics calculateStatistics(List<ExecutionEvent> events, ExecutionInstance instance) {
        long dispatches = count(events, ExecutionEventType.STEP_DISPATCHED);
        long retries = count(events, ExecutionEventType.STEP_RETRY_SCHEDULED);
        long failures = count(events, ExecutionEventType.STEP_FAILED);
        long skips = count(events, ExecutionEventType.STEP_SKIPPED);

        Instant end = instance.completedAt() != null ? instance.completedAt() : clock.instant();
        Duration totalDuration = Duration.between(instance.createdAt(), end);

        return new ExecutionStatistics(
            events.size(),
            instance.stepHistory().size(),
            dispatches,
            retries,
            failures,
            skips,
            totalDuration
        );
    }

    private static long count(List<ExecutionEvent> events, ExecutionEventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private static String actionKind(List<ExecutionEvent> stepEvents) {
        return stepEvents.stream()
            .map(ExecutionEvent::payload)
            .filter(p -> p != null && p.hasNonNull("actionKind"))
            .map(p -> p.get("actionKind").asText())
            .findFirst()
            .orElse(null);
    }

    private static String lastOutcome(List<ExecutionEvent> stepEvents) {
        for (int i = stepEvents.size() - 1; i >= 0; i--) {
            ExecutionEventType type = stepEvents.get(i).type();
            if (type != ExecutionEventType.STEP_DISPATCHED) {
                return type.name();
            }
        }
        return ExecutionEventType.STEP_DISPATCHED.name();
    }

    private static Duration stepDuration(List<ExecutionEvent> stepEvents) {
        Instant first = stepEvents.get(0).timestamp();
        Instant last = stepEvents.get(stepEvents.size() - 1).timestamp();
        return Duration.between(first, last);
    }

    private static double rate(long part, long total) {
        return total == 0 ? 0.0 : (double) part / total;
    }

    private static String summarizePayload(JsonNode payload) {
        if (payload == null || payload.isEmpty()) return null;
        String str = payload.toString();
        return str.length() > SUMMARY_LENGTH ? str.substring(0, SUMMARY_LENGTH) + "..." : str;
    }

    // ========== DTOs ==========

    public record ExecutionHistory(
        UUID executionId,
        String workflowId,
        String entityId,
        ExecutionStatus currentStatus,
        List<ExecutionEvent> events,
        List<TimelineEntry> timeline,
        Map<Integer, StepHistory> stepHistory,
        ExecutionStatistics statistics
    ) {}

    public record TimelineEntry(
        Instant timestamp,
        long sequenceNumber,
        String eventType,
        Integer stepIndex,
        String actorType,
        String summary
    ) {}

    public record StepHistory(
        int stepIndex,
        String actionKind,
        long dispatches,
        String lastOutcome,
        Duration duration
    ) {}

    public record ExecutionStatistics(
        long totalEvents,
        int finishedSteps,
        long dispatches,
        long retries,
        long failures,
        long skips,
        Duration totalDuration
    ) {}

    public record WorkflowStats(
        String workflowId,
        Instant since,
        long totalExecutions,
        Map<ExecutionStatus, Long> byStatus,
        double completionRate,
        double failureRate,
        Duration averageCompletionTime
    ) {}
}
