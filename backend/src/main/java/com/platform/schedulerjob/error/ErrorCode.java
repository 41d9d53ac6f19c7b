package com.platform.schedulerjob.error;

/**
 * Standardized error codes for the scheduler job control plane.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: SJ-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors (schema and pre-reconciliation checks)
 * - 3xx: Resource errors (not found)
 * - 4xx: Remote scheduler service errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("SJ-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("SJ-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("SJ-102", "Missing required field", ErrorCategory.RECOVERABLE),
    RECONCILIATION_PRECONDITION_FAILED("SJ-110", "Job configuration rejected before reconciliation", ErrorCategory.RECOVERABLE),
    INVALID_RESOURCE_ID("SJ-120", "Invalid job resource identifier", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    JOB_NOT_FOUND("SJ-301", "Scheduler job not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Remote Service Errors (4xx) ====================
    
    REMOTE_SERVICE_ERROR("SJ-400", "Scheduler service error", ErrorCategory.RECOVERABLE),
    REMOTE_SERVICE_UNAVAILABLE("SJ-401", "Scheduler service unavailable", ErrorCategory.RECOVERABLE),
    REMOTE_REQUEST_REJECTED("SJ-402", "Scheduler service rejected the request", ErrorCategory.RECOVERABLE),
    REMOTE_RESPONSE_INVALID("SJ-403", "Scheduler service returned an unreadable response", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    UNEXPECTED_ERROR("SJ-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("SJ-902", "Configuration error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("SJ-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - service is in bad state, may require intervention.
         */
        FATAL
    }
}
