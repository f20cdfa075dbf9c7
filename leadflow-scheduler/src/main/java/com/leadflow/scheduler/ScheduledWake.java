package com.leadflow.scheduler;

import java.time.Instant;
import java.util.UUID;

/**
 * A pending wake-up for one suspended execution.
 */
public record ScheduledWake(
    UUID wakeId,
    UUID executionId,
    Instant fireAt,
    Instant createdAt
) {
    public static ScheduledWake pending(UUID executionId, Instant fireAt, Instant createdAt) {
        return new ScheduledWake(UUID.randomUUID(), executionId, fireAt, createdAt);
    }

    public boolean isDue(Instant now) {
        return !fireAt.isAfter(now);
    }
}
