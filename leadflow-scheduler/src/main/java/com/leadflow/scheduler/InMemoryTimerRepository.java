package com.leadflow.scheduler;

import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TimerRepository.
 * Pending wakes are keyed by execution; claimed wakes are not kept.
 */
@Repository
public class InMemoryTimerRepository implements TimerRepository {

    private final Map<UUID, ScheduledWake> pendingByExecution = new ConcurrentHashMap<>();

    @Override
    public void upsert(ScheduledWake wake) {
        pendingByExecution.put(wake.executionId(), wake);
    }

    @Override
    public List<ScheduledWake> findDue(Instant now, int limit) {
        return pendingByExecution.values().stream()
            .filter(w -> w.isDue(now))
            .sorted(Comparator.comparing(ScheduledWake::fireAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean claim(UUID wakeId) {
        for (ScheduledWake wake : pendingByExecution.values()) {
            if (wake.wakeId().equals(wakeId)) {
                return pendingByExecution.remove(wake.executionId(), wake);
            }
        }
        return false;
    }

    @Override
    public int cancelForExecution(UUID executionId) {
        return pendingByExecution.remove(executionId) != null ? 1 : 0;
    }

    @Override
    public Optional<ScheduledWake> findPending(UUID executionId) {
        return Optional.ofNullable(pendingByExecution.get(executionId));
    }

    @Override
    public long countPending() {
        return pendingByExecution.size();
    }
}
