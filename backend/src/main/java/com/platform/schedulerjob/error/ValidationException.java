package com.platform.schedulerjob.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception for validation errors.
 * Raised before any remote call is made, so a rejected configuration never
 * leaves partial state behind on the scheduler service.
 */
public class ValidationException extends SchedulerJobException {
    
    private final List<FieldViolation> violations;
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.violations = List.of();
    }
    
    public ValidationException(ErrorCode errorCode, List<FieldViolation> violations) {
        super(errorCode, describe(errorCode, violations));
        this.violations = List.copyOf(violations);
    }
    
    public List<FieldViolation> getViolations() {
        return violations;
    }
    
    private static String describe(ErrorCode errorCode, List<FieldViolation> violations) {
        if (violations.isEmpty()) {
            return errorCode.getDefaultMessage();
        }
        return errorCode.getDefaultMessage() + ": " + violations.stream()
            .map(v -> v.field() + " " + v.message())
            .collect(Collectors.joining("; "));
    }
    
    /**
     * A single rejected field. Secret values are never recorded as rejected values.
     */
    public record FieldViolation(String field, Object rejectedValue, String message) {
        
        public static FieldViolation of(String field, String message) {
            return new FieldViolation(field, null, message);
        }
    }
}
