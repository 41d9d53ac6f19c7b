package com.platform.schedulerjob.reconciliation;

import java.time.Instant;

/**
 * One entry of the reconciliation history.
 */
public record ReconciliationRecord(
    ReconciliationAction action,
    String jobName,
    String jobId,
    ReconciliationOutcome outcome,
    Instant completedAt,
    long durationMs,
    String errorCode
) {
    
    public boolean isSuccessful() {
        return outcome != ReconciliationOutcome.REJECTED && outcome != ReconciliationOutcome.FAILED;
    }
}
