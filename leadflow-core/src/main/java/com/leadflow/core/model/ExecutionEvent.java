package com.leadflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened to an execution.
 * Append-only log for audit and execution timelines.
 * 
 * Primary Key: eventId
 * Index: (executionId, sequenceNumber)
 * 
 * Invariants:
 * - sequenceNumber is increasing within an execution
 * - events are never deleted or modified
 * - idempotencyKey prevents duplicate events
 */
public record ExecutionEvent(
    UUID eventId,
    UUID executionId,
    long sequenceNumber,
    ExecutionEventType type,
    Integer stepIndex,
    Instant timestamp,
    JsonNode payload,
    String idempotencyKey,
    String actorType,
    String actorId
) {
    public static final String ACTOR_SYSTEM = "SYSTEM";
    public static final String ACTOR_SCHEDULER = "SCHEDULER";
    public static final String ACTOR_RECOVERY = "RECOVERY";
    public static final String ACTOR_USER = "USER";

    /**
     * Create a new event.
     */
    public static ExecutionEvent create(
            UUID executionId,
            long sequenceNumber,
            ExecutionEventType type,
            Integer stepIndex,
            Instant timestamp,
            JsonNode payload,
            String idempotencyKey,
            String actorType,
            String actorId) {
        return new ExecutionEvent(
            UUID.randomUUID(),
            executionId,
            sequenceNumber,
            type,
            stepIndex,
            timestamp,
            payload,
            idempotencyKey,
            actorType,
            actorId
        );
    }

    public boolean isStepEvent() {
        return type.name().startsWith("STEP_");
    }
}
