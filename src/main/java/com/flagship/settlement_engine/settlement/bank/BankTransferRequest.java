package com.flagship.settlement_engine.settlement.bank;

import com.flagship.settlement_engine.settlement.BankDetails;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class BankTransferRequest {
    UUID payoutId;
    String professionalId;
    BigDecimal amount;
    String currency;
    BankDetails bankDetails;
}
