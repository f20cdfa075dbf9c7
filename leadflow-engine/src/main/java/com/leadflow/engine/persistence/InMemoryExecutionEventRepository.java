package com.leadflow.engine.persistence;

import com.leadflow.core.model.ExecutionEvent;
import com.leadflow.core.repository.ExecutionEventRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ExecutionEventRepository.
 * For demonstration and testing purposes.
 */
@Repository
public class InMemoryExecutionEventRepository implements ExecutionEventRepository {
    
    private final Map<UUID, List<ExecutionEvent>> eventsByExecution = new ConcurrentHashMap<>();
    private final Map<String, ExecutionEvent> eventsByIdempotencyKey = new ConcurrentHashMap<>();
    private final Map<UUID, AtomicLong> sequenceNumbers = new ConcurrentHashMap<>();
    
    @Override
    public boolean append(ExecutionEvent event) {
        if (eventsByIdempotencyKey.putIfAbsent(event.idempotencyKey(), event) != null) {
            return false;
        }
        List<ExecutionEvent> events = eventsByExecution.computeIfAbsent(event.executionId(), k -> new ArrayList<>());
        synchronized (events) {
            events.add(event);
        }
        return true;
    }
    
    @Override
    public List<ExecutionEvent> findByExecution(UUID executionId) {
        List<ExecutionEvent> events = eventsByExecution.getOrDefault(executionId, List.of());
        synchronized (events) {
            return events.stream()
                .sorted(Comparator.comparingLong(ExecutionEvent::sequenceNumber))
                .collect(Collectors.toList());
        }
    }
    
    @Override
    public Optional<ExecutionEvent> findByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(eventsByIdempotencyKey.get(idempotencyKey));
    }
    
    @Override
    public long getNextSequenceNumber(UUID executionId) {
        return sequenceNumbers.computeIfAbsent(executionId, k -> new AtomicLong(0)).incrementAndGet();
    }
}
