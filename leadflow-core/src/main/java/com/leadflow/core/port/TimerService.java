package com.leadflow.core.port;

import java.time.Duration;
import java.util.UUID;

/**
 * Durable wake-up timers for suspended executions.
 * Implementations must keep pending wakes across process restarts and
 * deliver each wake to the registered {@link WakeListener} at most once.
 */
public interface TimerService {

    /**
     * Schedule a wake for an execution after the given delay. An execution
     * has at most one pending wake; scheduling again replaces it.
     */
    void scheduleWake(UUID executionId, Duration delay);

    /**
     * Drop any pending wake for an execution.
     */
    void cancelWakes(UUID executionId);
}
