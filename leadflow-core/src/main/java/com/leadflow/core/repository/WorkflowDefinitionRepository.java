package com.leadflow.core.repository;

import com.leadflow.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for published workflow definitions.
 * Definitions are immutable apart from the active flag.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Save a newly published version.
     */
    void save(WorkflowDefinition definition);

    /**
     * Set the active flag of a published version.
     *
     * @return true if the definition exists
     */
    boolean setActive(String id, boolean active);

    Optional<WorkflowDefinition> findById(String id);

    /**
     * Latest version published under a name, active or not.
     */
    Optional<WorkflowDefinition> findLatest(String name);

    /**
     * All versions of a workflow, oldest first.
     */
    List<WorkflowDefinition> findVersions(String name);

    /**
     * Active definitions listening to a trigger kind.
     */
    List<WorkflowDefinition> findActiveByTriggerKind(String triggerKind);

    List<WorkflowDefinition> findAllActive();

    /**
     * Next version number for a workflow name (1 if none exists).
     */
    int getNextVersion(String name);
}
