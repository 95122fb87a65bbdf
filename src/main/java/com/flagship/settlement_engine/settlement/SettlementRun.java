package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.exception.InvalidStateTransitionException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit row of one monthly settlement batch. Counts are written when the run finishes.
 */
@Value
public class SettlementRun {
    UUID id;
    int periodMonth;
    int periodYear;
    SettlementRunStatus status;
    int eligibleCount;
    int invoicesCreated;
    int skippedCount;
    int failedCount;
    String requestedBy;
    Instant startedAt;
    Instant finishedAt;

    public static SettlementRun start(int month, int year, int eligibleCount, String requestedBy, Instant now) {
        return new SettlementRun(UUID.randomUUID(), month, year, SettlementRunStatus.RUNNING, eligibleCount,
            0, 0, 0, requestedBy, now, null);
    }

    public SettlementRun finish(boolean cancelled, int created, int skipped, int failed, Instant now) {
        requireRunning();
        return new SettlementRun(id, periodMonth, periodYear,
            cancelled ? SettlementRunStatus.CANCELLED : SettlementRunStatus.COMPLETED,
            eligibleCount, created, skipped, failed, requestedBy, startedAt, now);
    }

    /**
     * Closes a run whose worker is gone, e.g. after a restart.
     */
    public SettlementRun abandon(Instant now) {
        requireRunning();
        return new SettlementRun(id, periodMonth, periodYear, SettlementRunStatus.CANCELLED, eligibleCount,
            invoicesCreated, skippedCount, failedCount, requestedBy, startedAt, now);
    }

    private void requireRunning() {
        if (status != SettlementRunStatus.RUNNING) {
            throw new InvalidStateTransitionException(String.format(
                "Settlement run %s is already %s", id, status));
        }
    }
}
