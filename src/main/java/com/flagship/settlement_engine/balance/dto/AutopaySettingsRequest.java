package com.flagship.settlement_engine.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutopaySettingsRequest {

    @NotNull(message = "enabled is required")
    @JsonProperty("enabled")
    private Boolean enabled;

    /** Required when enabling. */
    @JsonProperty("payment_method_id")
    private String paymentMethodId;

    @JsonProperty("reason")
    private String reason;
}
