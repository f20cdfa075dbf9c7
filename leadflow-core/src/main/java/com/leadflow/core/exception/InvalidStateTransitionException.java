package com.leadflow.core.exception;

import com.leadflow.core.model.ExecutionStatus;

import java.util.UUID;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends LeadflowException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(ExecutionStatus currentStatus, ExecutionStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }
    
    public InvalidStateTransitionException(UUID executionId, ExecutionStatus currentStatus, ExecutionStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition execution %s from %s to %s",
            executionId, currentStatus, targetStatus
        ));
    }
    
    public InvalidStateTransitionException(String entityType, String currentState, String reason) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s in %s: %s",
            entityType, currentState, reason
        ));
    }
}
