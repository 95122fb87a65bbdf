package com.flagship.settlement_engine.commission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement_engine.commission.CommissionType;
import com.flagship.settlement_engine.commission.JobCompletion;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecordCommissionRequest {

    @NotBlank(message = "Job ID is required")
    @JsonProperty("job_id")
    private String jobId;

    @NotBlank(message = "Professional ID is required")
    @JsonProperty("professional_id")
    private String professionalId;

    @NotNull(message = "Job value is required")
    @DecimalMin(value = "0.01", message = "Job value must be greater than 0")
    @JsonProperty("job_value")
    private BigDecimal jobValue;

    @NotNull(message = "Commission type is required")
    @JsonProperty("commission_type")
    private CommissionType commissionType;

    @JsonProperty("category")
    private String category;

    @DecimalMin(value = "0.0", message = "Commission rate must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Commission rate must be between 0 and 1")
    @JsonProperty("commission_rate")
    private BigDecimal commissionRate;

    @JsonProperty("referrer_id")
    private String referrerId;

    @DecimalMin(value = "0.0", message = "Referrer share rate must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Referrer share rate must be between 0 and 1")
    @JsonProperty("referrer_share_rate")
    private BigDecimal referrerShareRate;

    @JsonProperty("completed_at")
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
