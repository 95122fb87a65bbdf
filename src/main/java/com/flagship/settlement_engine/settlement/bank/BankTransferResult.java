package com.flagship.settlement_engine.settlement.bank;

import lombok.Value;

@Value
public class BankTransferResult {
    boolean accepted;
    String reference;
    String errorMessage;

    public static BankTransferResult accepted(String reference) {
        return new BankTransferResult(true, reference, null);
    }

    public static BankTransferResult rejected(String errorMessage) {
        return new BankTransferResult(false, null, errorMessage);
    }
}
