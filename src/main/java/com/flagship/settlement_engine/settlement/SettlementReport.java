package com.flagship.settlement_engine.settlement;

import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a monthly run per professional. Every eligible professional appears in
 * exactly one of created, skipped, failed or notProcessed; the last is non-empty
 * only for a cancelled run.
 */
@Value
public class SettlementReport {
    UUID runId;
    int periodMonth;
    int periodYear;
    SettlementRunStatus status;
    int eligibleCount;
    List<String> invoicedProfessionals;
    List<String> skippedProfessionals;
    List<SettlementError> errors;
    List<String> notProcessed;
    Duration duration;

    public int getInvoicesCreated() {
        return invoicedProfessionals.size();
    }

    public int getSkippedCount() {
        return skippedProfessionals.size();
    }

    public int getFailedCount() {
        return errors.size();
    }
}
