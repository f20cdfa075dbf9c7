package com.leadflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadflow.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One entity's progress through one workflow definition.
 * Primary source of truth for execution state.
 * 
 * Primary Key: id
 * Unique Constraint: (workflowId, entityId) among active executions
 * 
 * Invariants:
 * - at most one active execution per (workflowId, entityId)
 * - currentStepIndex only advances past an index with a StepRecord
 * - retryCountForCurrentStep <= the step's maxRetries
 * - version is monotonically increasing (optimistic lock)
 * - terminal executions are never modified
 */
public record ExecutionInstance(
    // Primary key
    UUID id,
    
    // Identity
    String workflowId,
    String entityId,
    String triggerKind,
    JsonNode triggerPayload,
    
    // State
    ExecutionStatus status,
    int currentStepIndex,
    ObjectNode context,
    int retryCountForCurrentStep,
    WakeAction pendingWake,
    List<StepRecord> stepHistory,
    
    // Error tracking
    String error,
    String errorCode,
    
    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant nextWakeAt,
    Instant completedAt,
    
    // Versioning (optimistic locking)
    long version
) {
    public static final String CONTEXT_TRIGGER = "trigger";
    public static final String CONTEXT_STEP_PREFIX = "step_";

    public ExecutionInstance {
        stepHistory = stepHistory == null ? List.of() : List.copyOf(stepHistory);
        context = context == null ? JsonNodeFactory.instance.objectNode() : context.deepCopy();
    }

    /**
     * Create a new execution in RUNNING state at step 0.
     * The trigger payload is kept in the context under {@code trigger}.
     */
    public static ExecutionInstance create(
            String workflowId,
            String entityId,
            String triggerKind,
            JsonNode triggerPayload,
            Instant now) {
        ObjectNode context = JsonNodeFactory.instance.objectNode();
        if (triggerPayload != null && !triggerPayload.isNull()) {
            context.set(CONTEXT_TRIGGER, triggerPayload.deepCopy());
        }
        return new ExecutionInstance(
            UUID.randomUUID(),
            workflowId,
            entityId,
            triggerKind,
            triggerPayload,
            ExecutionStatus.RUNNING,
            0,
            context,
            0,
            null,
            List.of(),
            null,
            null,
            now,
            now,
            null,
            null,
            0L
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean hasPendingWake() {
        return pendingWake != null;
    }

    /**
     * Check whether the step at the given index has a recorded result.
     */
    public boolean hasRecordFor(int index) {
        return stepHistory.stream().anyMatch(r -> r.index() == index);
    }

    /**
     * Output a step merged into the context, if any.
     */
    public JsonNode stepOutput(int index) {
        return context.get(CONTEXT_STEP_PREFIX + index);
    }

    /**
     * Create a copy with the finished step recorded and its output merged
     * into the context under {@code step_<index>}.
     */
    public ExecutionInstance withStepRecorded(StepRecord record, JsonNode output, Instant now) {
        if (record.index() != currentStepIndex) {
            throw new InvalidStateTransitionException("ExecutionInstance", status.name(),
                "cannot record step " + record.index() + " while at step " + currentStepIndex);
        }
        ObjectNode newContext = context.deepCopy();
        if (output != null && !output.isNull()) {
            newContext.set(CONTEXT_STEP_PREFIX + record.index(), output.deepCopy());
        }
        return toBuilder()
            .context(newContext)
            .appendStep(record)
            .updatedAt(now)
            .incrementVersion()
            .build();
    }

    /**
     * Create a copy positioned at the next step.
     *
     * @throws InvalidStateTransitionException if the current step has no recorded result
     */
    public ExecutionInstance advance(Instant now) {
        if (!hasRecordFor(currentStepIndex)) {
            throw new InvalidStateTransitionException("ExecutionInstance", status.name(),
                "step " + currentStepIndex + " has no recorded result");
        }
        return toBuilder()
            .currentStepIndex(currentStepIndex + 1)
            .retryCountForCurrentStep(0)
            .pendingWake(null)
            .nextWakeAt(null)
            .updatedAt(now)
            .incrementVersion()
            .build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID id;
        private String workflowId;
        private String entityId;
        private String triggerKind;
        private JsonNode triggerPayload;
        private ExecutionStatus status;
        private int currentStepIndex;
        private ObjectNode context;
        private int retryCountForCurrentStep;
        private WakeAction pendingWake;
        private List<StepRecord> stepHistory;
        private String error;
        private String errorCode;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant nextWakeAt;
        private Instant completedAt;
        private long version;

        public Builder(ExecutionInstance instance) {
            this.id = instance.id();
            this.workflowId = instance.workflowId();
            this.entityId = instance.entityId();
            this.triggerKind = instance.triggerKind();
            this.triggerPayload = instance.triggerPayload();
            this.status = instance.status();
            this.currentStepIndex = instance.currentStepIndex();
            this.context = instance.context();
            this.retryCountForCurrentStep = instance.retryCountForCurrentStep();
            this.pendingWake = instance.pendingWake();
            this.stepHistory = instance.stepHistory();
            this.error = instance.error();
            this.errorCode = instance.errorCode();
            this.createdAt = instance.createdAt();
            this.updatedAt = instance.updatedAt();
            this.nextWakeAt = instance.nextWakeAt();
            this.completedAt = instance.completedAt();
            this.version = instance.version();
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentStepIndex(int currentStepIndex) {
            this.currentStepIndex = currentStepIndex;
            return this;
        }

        public Builder context(ObjectNode context) {
            this.context = context;
            return this;
        }

        public Builder retryCountForCurrentStep(int retryCountForCurrentStep) {
            this.retryCountForCurrentStep = retryCountForCurrentStep;
            return this;
        }

        public Builder pendingWake(WakeAction pendingWake) {
            this.pendingWake = pendingWake;
            return this;
        }

        public Builder appendStep(StepRecord record) {
            List<StepRecord> history = new ArrayList<>(stepHistory);
            history.add(record);
            this.stepHistory = history;
            return this;
        }

        public Builder error(String errorCode, String error) {
            this.errorCode = errorCode;
            this.error = error;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder nextWakeAt(Instant nextWakeAt) {
            this.nextWakeAt = nextWakeAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public ExecutionInstance build() {
            return new ExecutionInstance(
                id, workflowId, entityId, triggerKind, triggerPayload,
                status, currentStepIndex, context, retryCountForCurrentStep,
                pendingWake, stepHistory, error, errorCode,
                createdAt, updatedAt, nextWakeAt, completedAt, version
            );
        }
    }
}
