package com.platform.schedulerjob.error;

/**
 * Exception for failed calls to the remote scheduler service.
 * Carries the operation and job identity so the failure can be surfaced verbatim.
 */
public class RemoteServiceException extends SchedulerJobException {
    
    private final String operation;
    private final String jobId;
    private final int statusCode;
    private final String responseBody;
    
    public RemoteServiceException(ErrorCode errorCode, String operation, String jobId,
            int statusCode, String responseBody, String message) {
        super(errorCode, message);
        this.operation = operation;
        this.jobId = jobId;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
    
    public RemoteServiceException(ErrorCode errorCode, String operation, String jobId, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.operation = operation;
        this.jobId = jobId;
        this.statusCode = -1;
        this.responseBody = null;
    }
    
    public static RemoteServiceException rejected(String operation, String jobId, int statusCode, String responseBody) {
        return new RemoteServiceException(
            ErrorCode.REMOTE_REQUEST_REJECTED,
            operation,
            jobId,
            statusCode,
            responseBody,
            String.format("Error issuing %s request for Scheduler Job %s (status %d): %s",
                operation, jobId, statusCode, responseBody)
        );
    }
    
    public static RemoteServiceException unreachable(String operation, String jobId, Throwable cause) {
        return new RemoteServiceException(
            ErrorCode.REMOTE_SERVICE_UNAVAILABLE,
            operation,
            jobId,
            String.format("Scheduler service unreachable during %s of Scheduler Job %s: %s",
                operation, jobId, cause.getMessage()),
            cause
        );
    }
    
    public static RemoteServiceException unreadable(String operation, String jobId, Throwable cause) {
        return new RemoteServiceException(
            ErrorCode.REMOTE_RESPONSE_INVALID,
            operation,
            jobId,
            String.format("Unreadable %s response for Scheduler Job %s: %s",
                operation, jobId, cause.getMessage()),
            cause
        );
    }
    
    public static RemoteServiceException missingAfterWrite(String jobId) {
        return new RemoteServiceException(
            ErrorCode.REMOTE_SERVICE_ERROR,
            "read",
            jobId,
            404,
            null,
            String.format("Scheduler Job %s was not found immediately after create/update", jobId)
        );
    }
    
    public String getOperation() {
        return operation;
    }
    
    public String getJobId() {
        return jobId;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public String getResponseBody() {
        return responseBody;
    }
}
