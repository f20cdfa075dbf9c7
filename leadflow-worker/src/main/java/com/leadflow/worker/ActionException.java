package com.leadflow.worker;

/**
 * Exception thrown by action handlers on failure.
 */
public class ActionException extends Exception {
    
    private final String errorCode;
    private final boolean retryable;
    
    public ActionException(String errorCode, String message) {
        this(errorCode, message, true);
    }
    
    public ActionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public ActionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
    
    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ActionException permanent(String errorCode, String message) {
        return new ActionException(errorCode, message, false);
    }
    
    /**
     * Create a retryable exception (transient failure).
     */
    public static ActionException transient_(String errorCode, String message) {
        return new ActionException(errorCode, message, true);
    }
}
