package com.flagship.settlement_engine.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "settlement_runs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementRunEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "period_month", nullable = false, updatable = false)
    private int periodMonth;

    @Column(name = "period_year", nullable = false, updatable = false)
    private int periodYear;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SettlementRunStatus status;

    @Column(name = "eligible_count", nullable = false, updatable = false)
    private int eligibleCount;

    @Column(name = "invoices_created", nullable = false)
    private int invoicesCreated;

    @Column(name = "skipped_count", nullable = false)
    private int skippedCount;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Column(name = "requested_by", updatable = false, length = 64)
    private String requestedBy;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    static SettlementRunEntity fromDomain(SettlementRun run) {
        return new SettlementRunEntity(run.getId(), run.getPeriodMonth(), run.getPeriodYear(), run.getStatus(),
            run.getEligibleCount(), run.getInvoicesCreated(), run.getSkippedCount(), run.getFailedCount(),
            run.getRequestedBy(), run.getStartedAt(), run.getFinishedAt());
    }

    public SettlementRun toDomain() {
        return new SettlementRun(id, periodMonth, periodYear, status, eligibleCount, invoicesCreated,
            skippedCount, failedCount, requestedBy, startedAt, finishedAt);
    }

    void updateFromDomain(SettlementRun run) {
        this.status = run.getStatus();
        this.invoicesCreated = run.getInvoicesCreated();
        this.skippedCount = run.getSkippedCount();
        this.failedCount = run.getFailedCount();
        this.finishedAt = run.getFinishedAt();
    }
}
