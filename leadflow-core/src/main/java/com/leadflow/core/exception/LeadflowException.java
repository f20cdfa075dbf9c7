package com.leadflow.core.exception;

/**
 * Base exception for all engine errors.
 */
public class LeadflowException extends RuntimeException {
    
    private final String errorCode;
    
    public LeadflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public LeadflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
