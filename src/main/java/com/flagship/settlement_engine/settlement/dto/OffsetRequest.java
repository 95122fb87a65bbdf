package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A gives up revenue shares, B's commission debt is reduced by the same amount.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OffsetRequest {

    @NotBlank(message = "Professional A ID is required")
    @JsonProperty("professional_a_id")
    private String professionalAId;

    @NotBlank(message = "Professional B ID is required")
    @JsonProperty("professional_b_id")
    private String professionalBId;

    @NotNull(message = "Offset amount is required")
    @DecimalMin(value = "0.01", message = "Offset amount must be greater than 0")
    @JsonProperty("offset_amount")
    private BigDecimal offsetAmount;

    @Size(max = 500)
    @JsonProperty("description")
    private String description;
}
