package com.platform.schedulerjob.observability;

/**
 * Event types emitted by {@link StructuredLogger}.
 */
public enum LogEventType {
    JOB_APPLY_STARTED,
    JOB_APPLY_COMPLETED,
    JOB_APPLY_FAILED,
    JOB_VALIDATION_FAILED,
    JOB_READ_COMPLETED,
    JOB_GONE,
    JOB_DELETED,
    JOB_DELETE_FAILED
}
