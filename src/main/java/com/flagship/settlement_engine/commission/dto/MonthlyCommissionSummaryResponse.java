package com.flagship.settlement_engine.commission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.commission.MonthlyCommissionSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class MonthlyCommissionSummaryResponse {

    @JsonProperty("professional_id")
    String professionalId;

    @JsonProperty("month")
    int month;

    @JsonProperty("year")
    int year;

    @JsonProperty("total_owed")
    BigDecimal totalOwed;

    @JsonProperty("total_earned")
    BigDecimal totalEarned;

    @JsonProperty("job_count")
    int jobCount;

    @JsonProperty("commissions")
    List<CommissionFactResponse> commissions;

    public static MonthlyCommissionSummaryResponse from(MonthlyCommissionSummary summary) {
        return MonthlyCommissionSummaryResponse.builder()
            .professionalId(summary.getProfessionalId())
            .month(summary.getMonth())
            .year(summary.getYear())
            .totalOwed(summary.getTotalOwed())
            .totalEarned(summary.getTotalEarned())
            .jobCount(summary.getJobCount())
            .commissions(summary.getFacts().stream().map(CommissionFactResponse::from).toList())
            .build();
    }
}
