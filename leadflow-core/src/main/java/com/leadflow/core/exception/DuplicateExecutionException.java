package com.leadflow.core.exception;

import java.util.UUID;

/**
 * Thrown when an explicit enrollment is requested for an entity that already
 * has an active execution of the workflow.
 */
public class DuplicateExecutionException extends LeadflowException {
    
    public static final String ERROR_CODE = "DUPLICATE_EXECUTION";
    
    private final UUID existingExecutionId;
    
    public DuplicateExecutionException(String workflowId, String entityId, UUID existingExecutionId) {
        super(ERROR_CODE, String.format(
            "Entity '%s' already has an active execution of workflow '%s': %s",
            entityId, workflowId, existingExecutionId
        ));
        this.existingExecutionId = existingExecutionId;
    }
    
    public UUID getExistingExecutionId() {
        return existingExecutionId;
    }
}
