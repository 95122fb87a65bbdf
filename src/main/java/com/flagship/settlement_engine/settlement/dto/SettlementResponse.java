package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.invoice.dto.InvoiceResponse;
import com.flagship.settlement_engine.settlement.MonthlySettlement;
import com.flagship.settlement_engine.settlement.SettlementReport;
import com.flagship.settlement_engine.settlement.SettlementRunStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("invoices")
    List<InvoiceResponse> invoices;

    @JsonProperty("report")
    Report report;

    @Value
    @Builder
    public static class Report {

        @JsonProperty("run_id")
        UUID runId;

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

        @JsonProperty("skipped")
        List<String> skipped;

        @JsonProperty("errors")
        List<SettlementErrorResponse> errors;

        @JsonProperty("not_processed")
        List<String> notProcessed;

        @JsonProperty("duration_ms")
        long durationMs;

        static Report from(SettlementReport report) {
            return Report.builder()
                .runId(report.getRunId())
                .periodMonth(report.getPeriodMonth())
                .periodYear(report.getPeriodYear())
                .status(report.getStatus())
                .eligibleCount(report.getEligibleCount())
                .invoicesCreated(report.getInvoicesCreated())
                .skipped(report.getSkippedProfessionals())
                .errors(report.getErrors().stream().map(SettlementErrorResponse::from).toList())
                .notProcessed(report.getNotProcessed())
                .durationMs(report.getDuration().toMillis())
                .build();
        }
    }

    public static SettlementResponse from(MonthlySettlement settlement) {
        return SettlementResponse.builder()
            .invoices(settlement.getInvoices().stream().map(InvoiceResponse::from).toList())
            .report(Report.from(settlement.getReport()))
            .build();
    }
}
