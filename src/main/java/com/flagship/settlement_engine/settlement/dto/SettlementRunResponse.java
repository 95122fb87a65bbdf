package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.settlement.SettlementRun;
import com.flagship.settlement_engine.settlement.SettlementRunStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementRunResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("period_month")
    int periodMonth;

    @JsonProperty("period_year")
    int periodYear;

    @JsonProperty("status")
    SettlementRunStatus status;

    @JsonProperty("eligible_count")
    int eligibleCount;

    @JsonProperty("invoices_created")
    int invoicesCreated;

    @JsonProperty("skipped_count")
    int skippedCount;

    @JsonProperty("failed_count")
    int failedCount;

    @JsonProperty("requested_by")
    String requestedBy;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    public static SettlementRunResponse from(SettlementRun run) {
        return SettlementRunResponse.builder()
            .id(run.getId())
            .periodMonth(run.getPeriodMonth())
            .periodYear(run.getPeriodYear())
            .status(run.getStatus())
            .eligibleCount(run.getEligibleCount())
            .invoicesCreated(run.getInvoicesCreated())
            .skippedCount(run.getSkippedCount())
            .failedCount(run.getFailedCount())
            .requestedBy(run.getRequestedBy())
            .startedAt(run.getStartedAt())
            .finishedAt(run.getFinishedAt())
            .build();
    }
}
