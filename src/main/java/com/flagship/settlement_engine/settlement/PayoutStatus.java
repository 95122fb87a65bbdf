package com.flagship.settlement_engine.settlement;

/**
 * QUEUED and PENDING_MANUAL wait for bulk processing; PROCESSING marks a transfer
 * handed to the bank. COMPLETED and FAILED are final.
 */
public enum PayoutStatus {
    QUEUED,
    PENDING_MANUAL,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isAwaitingProcessing() {
        return this == QUEUED || this == PENDING_MANUAL;
    }
}
