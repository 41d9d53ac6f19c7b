package com.platform.schedulerjob.reconciliation;

/**
 * How a reconciliation action ended.
 */
public enum ReconciliationOutcome {
    SUCCEEDED,
    REJECTED,   // validation failed, nothing sent
    GONE,       // read found no job
    ALREADY_ABSENT,
    FAILED
}
