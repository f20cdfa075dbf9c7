package com.leadflow.scheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for scheduled wakes. Holds at most one pending wake per execution.
 */
public interface TimerRepository {

    /**
     * Store a pending wake, replacing any pending wake of the same execution.
     */
    void upsert(ScheduledWake wake);

    /**
     * Pending wakes due at or before {@code now}, earliest first.
     */
    List<ScheduledWake> findDue(Instant now, int limit);

    /**
     * Remove a wake if it is still pending. Only the caller that removes it
     * may fire it.
     *
     * @return true if this call claimed it
     */
    boolean claim(UUID wakeId);

    /**
     * Remove the pending wake of an execution.
     *
     * @return number of wakes removed
     */
    int cancelForExecution(UUID executionId);

    Optional<ScheduledWake> findPending(UUID executionId);

    long countPending();
}
