package com.leadflow.engine.persistence;

import com.leadflow.core.exception.OptimisticLockException;
import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.ExecutionStatus;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ExecutionInstanceRepository.
 * 
 * An index of active executions keyed by (workflowId, entityId) makes the
 * conditional insert atomic. Updates are compare-and-set on the version.
 */
@Repository
public class InMemoryExecutionInstanceRepository implements ExecutionInstanceRepository {
    
    private final Map<UUID, ExecutionInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, UUID> activeIndex = new ConcurrentHashMap<>();
    
    @Override
    public boolean insertIfNoActive(ExecutionInstance instance) {
        if (!instance.isActive()) {
            throw new IllegalArgumentException("Only active executions can be inserted");
        }
        if (activeIndex.putIfAbsent(activeKey(instance.workflowId(), instance.entityId()), instance.id()) != null) {
            return false;
        }
        instances.put(instance.id(), instance);
        return true;
    }
    
    @Override
    public void update(ExecutionInstance instance, long expectedVersion) {
        boolean[] replaced = {false};
        instances.computeIfPresent(instance.id(), (id, current) -> {
            if (current.version() != expectedVersion) {
                return current;
            }
            replaced[0] = true;
            return instance;
        });
        
        if (!replaced[0]) {
            ExecutionInstance current = instances.get(instance.id());
            if (current == null) {
                throw new OptimisticLockException("ExecutionInstance", instance.id().toString(), expectedVersion);
            }
            throw new OptimisticLockException("ExecutionInstance", instance.id().toString(),
                expectedVersion, current.version());
        }
        
        if (instance.isTerminal()) {
            activeIndex.remove(activeKey(instance.workflowId(), instance.entityId()), instance.id());
        }
    }
    
    @Override
    public Optional<ExecutionInstance> findById(UUID id) {
        return Optional.ofNullable(instances.get(id));
    }
    
    @Override
    public Optional<ExecutionInstance> findActive(String workflowId, String entityId) {
        UUID id = activeIndex.get(activeKey(workflowId, entityId));
        return id == null ? Optional.empty() : findById(id).filter(ExecutionInstance::isActive);
    }
    
    @Override
    public Optional<ExecutionInstance> findLatestFinished(String workflowId, String entityId) {
        return instances.values().stream()
            .filter(i -> i.workflowId().equals(workflowId) && i.entityId().equals(entityId))
            .filter(i -> i.status() == ExecutionStatus.COMPLETED || i.status() == ExecutionStatus.FAILED)
            .filter(i -> i.completedAt() != null)
            .max(Comparator.comparing(ExecutionInstance::completedAt));
    }
    
    @Override
    public long countByWorkflowAndEntity(String workflowId, String entityId) {
        return instances.values().stream()
            .filter(i -> i.workflowId().equals(workflowId) && i.entityId().equals(entityId))
            .count();
    }
    
    @Override
    public List<ExecutionInstance> findByWorkflow(String workflowId, Instant createdSince) {
        return instances.values().stream()
            .filter(i -> i.workflowId().equals(workflowId))
            .filter(i -> createdSince == null || !i.createdAt().isBefore(createdSince))
            .sorted(Comparator.comparing(ExecutionInstance::createdAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<ExecutionInstance> findByEntity(String entityId) {
        return instances.values().stream()
            .filter(i -> i.entityId().equals(entityId))
            .sorted(Comparator.comparing(ExecutionInstance::createdAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<ExecutionInstance> findOverdueWaiting(Instant wakeBefore, int limit) {
        return instances.values().stream()
            .filter(i -> i.status() == ExecutionStatus.WAITING)
            .filter(i -> i.nextWakeAt() != null && i.nextWakeAt().isBefore(wakeBefore))
            .sorted(Comparator.comparing(ExecutionInstance::nextWakeAt))
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        return instances.values().stream()
            .collect(Collectors.groupingBy(ExecutionInstance::status,
                () -> new EnumMap<>(ExecutionStatus.class), Collectors.counting()));
    }
    
    private static String activeKey(String workflowId, String entityId) {
        return workflowId + "|" + entityId;
    }
}
