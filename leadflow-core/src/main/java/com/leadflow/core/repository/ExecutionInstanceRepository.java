package com.leadflow.core.repository;

import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow executions.
 * Enforces one active execution per (workflowId, entityId) and optimistic
 * locking on the version column.
 */
public interface ExecutionInstanceRepository {

    /**
     * Insert a new execution unless the entity already has an active
     * execution of the same workflow. The check and the insert are atomic.
     *
     * @return true if inserted, false if an active execution exists
     */
    boolean insertIfNoActive(ExecutionInstance instance);

    /**
     * Replace a stored execution if its version is still the expected one.
     *
     * @param instance the new state, with a version greater than expectedVersion
     * @param expectedVersion the version the change was computed from
     * @throws com.leadflow.core.exception.OptimisticLockException if the stored version differs
     */
    void update(ExecutionInstance instance, long expectedVersion);

    Optional<ExecutionInstance> findById(UUID id);

    /**
     * The active (RUNNING, WAITING or PAUSED) execution for a pair, if any.
     */
    Optional<ExecutionInstance> findActive(String workflowId, String entityId);

    /**
     * Most recently finished COMPLETED or FAILED execution for a pair.
     */
    Optional<ExecutionInstance> findLatestFinished(String workflowId, String entityId);

    /**
     * Number of executions ever created for a pair, any status.
     */
    long countByWorkflowAndEntity(String workflowId, String entityId);

    /**
     * Executions of a workflow created at or after the given time.
     */
    List<ExecutionInstance> findByWorkflow(String workflowId, Instant createdSince);

    List<ExecutionInstance> findByEntity(String entityId);

    /**
     * WAITING executions whose wake time is before the given instant.
     */
    List<ExecutionInstance> findOverdueWaiting(Instant wakeBefore, int limit);

    Map<ExecutionStatus, Long> countByStatus();
}
