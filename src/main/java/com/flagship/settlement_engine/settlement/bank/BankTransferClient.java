package com.flagship.settlement_engine.settlement.bank;

/**
 * Outbound port to the bank that executes payout transfers.
 *
 * Implementations report a rejection as a result and throw only when the bank
 * could not be reached or answered with something unreadable.
 */
public interface BankTransferClient {

    BankTransferResult transfer(BankTransferRequest request);
}
