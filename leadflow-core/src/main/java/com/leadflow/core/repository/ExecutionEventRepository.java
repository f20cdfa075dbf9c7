package com.leadflow.core.repository;

import com.leadflow.core.model.ExecutionEvent;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for execution events.
 * Events are append-only and immutable.
 */
public interface ExecutionEventRepository {

    /**
     * Append an event to the log.
     *
     * @return false if an event with the same idempotency key already exists
     */
    boolean append(ExecutionEvent event);

    /**
     * All events of an execution in sequence order.
     */
    List<ExecutionEvent> findByExecution(UUID executionId);

    Optional<ExecutionEvent> findByIdempotencyKey(String idempotencyKey);

    /**
     * Next sequence number for an execution (1 for the first event).
     */
    long getNextSequenceNumber(UUID executionId);
}
