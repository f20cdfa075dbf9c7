package com.leadflow.core.rule;

import com.leadflow.core.model.EntitySnapshot;
import com.leadflow.core.model.FieldType;

import java.time.Instant;

/**
 * A field whose value is derived from the snapshot at evaluation time
 * rather than stored on the entity.
 */
public interface ComputedField {

    /**
     * Field name as referenced by rules.
     */
    String name();

    /**
     * Declared type, used when validating rules.
     */
    FieldType type();

    /**
     * Compute the value. May return null when the inputs are missing.
     */
    Object compute(EntitySnapshot snapshot, Instant evaluationTime);
}
