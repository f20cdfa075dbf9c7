package com.leadflow.engine.persistence;

import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.repository.WorkflowDefinitionRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 * For demonstration and testing purposes.
 */
@Repository
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {
    
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    
    @Override
    public void save(WorkflowDefinition definition) {
        definitions.put(definition.id(), definition);
    }
    
    @Override
    public boolean setActive(String id, boolean active) {
        WorkflowDefinition updated = definitions.computeIfPresent(id, (key, existing) -> existing.withActive(active));
        return updated != null;
    }
    
    @Override
    public Optional<WorkflowDefinition> findById(String id) {
        return Optional.ofNullable(definitions.get(id));
    }
    
    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .max(Comparator.comparingInt(WorkflowDefinition::version));
    }
    
    @Override
    public List<WorkflowDefinition> findVersions(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .sorted(Comparator.comparingInt(WorkflowDefinition::version))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<WorkflowDefinition> findActiveByTriggerKind(String triggerKind) {
        return definitions.values().stream()
            .filter(WorkflowDefinition::active)
            .filter(d -> d.triggerKind().equals(triggerKind))
            .sorted(Comparator.comparing(WorkflowDefinition::id))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<WorkflowDefinition> findAllActive() {
        return definitions.values().stream()
            .filter(WorkflowDefinition::active)
            .sorted(Comparator.comparing(WorkflowDefinition::id))
            .collect(Collectors.toList());
    }
    
    @Override
    public int getNextVersion(String name) {
        return findLatest(name).map(d -> d.version() + 1).orElse(1);
    }
}
