package com.leadflow.core.port;

import com.leadflow.core.model.EntitySnapshot;

import java.util.Optional;

/**
 * Supplies the current fields of an entity for rule evaluation.
 * Implemented by the system that owns entity persistence.
 */
@FunctionalInterface
public interface EntitySnapshotProvider {

    /**
     * @return the entity's current snapshot, or empty if it does not exist
     */
    Optional<EntitySnapshot> getSnapshot(String entityId);
}
