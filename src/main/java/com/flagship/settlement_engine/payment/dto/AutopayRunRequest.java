package com.flagship.settlement_engine.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * All fields optional: an empty body charges everything due now.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutopayRunRequest {

    @JsonProperty("as_of")
    private Instant asOf;

    @Min(value = 1, message = "Month must be between 1 and 12")
    @Max(value = 12, message = "Month must be between 1 and 12")
    @JsonProperty("month")
    private Integer month;

    @Min(value = 2000, message = "Year must be 2000 or later")
    @JsonProperty("year")
    private Integer year;
}
