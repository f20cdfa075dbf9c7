package com.leadflow.core.exception;

/**
 * Thrown when a workflow, execution or segment is not found.
 */
public class NotFoundException extends LeadflowException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
