package com.platform.schedulerjob.error;

/**
 * Base exception for all scheduler job control plane exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class SchedulerJobException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected SchedulerJobException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected SchedulerJobException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected SchedulerJobException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
