package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreatePayoutRequest {

    @NotBlank(message = "Professional ID is required")
    @JsonProperty("professional_id")
    private String professionalId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    private BigDecimal amount;

    @NotBlank(message = "Payout method is required")
    @JsonProperty("payout_method")
    private String payoutMethod;

    @Valid
    @JsonProperty("bank_details")
    private BankDetailsDto bankDetails;

    @Size(max = 128)
    @JsonProperty("reference")
    private String reference;
}
