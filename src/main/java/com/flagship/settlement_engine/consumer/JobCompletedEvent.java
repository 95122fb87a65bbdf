package com.flagship.settlement_engine.consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flagship.settlement_engine.commission.CommissionType;
import com.flagship.settlement_engine.commission.JobCompletion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JobCompleted message published by the lead/proposal service on the job events topic.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobCompletedEvent {

    public static final String EVENT_TYPE = "JobCompleted";

    private UUID eventId;
    private String jobId;
    private String professionalId;
    private BigDecimal jobValue;
    private String category;
    private CommissionType commissionType;
    private BigDecimal commissionRate;
    private String referrerId;
    private BigDecimal referrerShareRate;
    private Instant completedAt;

    public JobCompletion toJobCompletion(String recordedBy) {
        return JobCompletion.builder()
            .jobId(jobId)
            .professionalId(professionalId)
            .jobValue(jobValue)
            .commissionType(commissionType)
            .category(category)
            .commissionRate(commissionRate)
            .referrerId(referrerId)
            .referrerShareRate(referrerShareRate)
            .completedAt(completedAt)
            .recordedBy(recordedBy)
            .build();
    }
}
