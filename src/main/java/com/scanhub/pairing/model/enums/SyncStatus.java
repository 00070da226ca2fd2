package com.scanhub.pairing.model.enums;

/**
 * Legacy reconciliation status of a pairing record.
 *
 * PENDING moves to SUCCESS or FAILURE exactly once; both are terminal.
 */
public enum SyncStatus {

    /**
     * Committed locally, not yet confirmed by the legacy system
     */
    PENDING,

    /**
     * Legacy system accepted the pairing
     */
    SUCCESS,

    /**
     * Legacy system rejected the pairing or the call failed
     */
    FAILURE;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
