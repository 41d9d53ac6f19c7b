package com.platform.schedulerjob.reconciliation;

/**
 * Reconciliation actions exposed to callers.
 */
public enum ReconciliationAction {
    APPLY,
    READ,
    DELETE
}
