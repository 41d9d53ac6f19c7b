package com.platform.schedulerjob.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response model.
 * Every failed reconciliation request returns this structure.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Unique error code (e.g., SJ-110).
     */
    private String code;

    /**
     * Human-readable error message.
     */
    private String message;

    /**
     * Detailed description for debugging.
     */
    private String detail;

    /**
     * Whether this error is fatal (requires intervention) or recoverable (can retry).
     */
    private boolean fatal;

    /**
     * HTTP status code.
     */
    private int status;

    private Instant timestamp;

    /**
     * Request path that caused the error.
     */
    private String path;

    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;

    /**
     * Field-level validation errors, in configuration document terms.
     */
    private List<FieldError> fieldErrors;

    /**
     * Job identity and remote call context.
     */
    private Map<String, Object> metadata;

    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;

        public static FieldError from(ValidationException.FieldViolation violation) {
            return FieldError.builder()
                .field(violation.field())
                .message(violation.message())
                .rejectedValue(violation.rejectedValue())
                .build();
        }
    }

    /**
     * Create from ErrorCode with custom message.
     */
    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
