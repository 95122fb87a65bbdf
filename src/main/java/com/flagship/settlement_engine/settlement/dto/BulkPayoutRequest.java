package com.flagship.settlement_engine.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkPayoutRequest {

    @NotEmpty(message = "At least one payout ID is required")
    @JsonProperty("payout_ids")
    private List<UUID> payoutIds;
}
