package com.flagship.settlement_engine.balance;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Journal entry written for every balance mutation, with the balance as it stood afterwards.
 */
@Value
public class BalanceMovement {
    UUID id;
    String professionalId;
    MovementType movementType;
    BigDecimal amount;
    UUID referenceId;
    BigDecimal outstandingAfter;
    BigDecimal pendingAfter;
    BigDecimal netAfter;
    Instant createdAt;

    public static BalanceMovement of(Balance after, MovementType type, BigDecimal amount, UUID referenceId) {
        return new BalanceMovement(
            UUID.randomUUID(),
            after.getProfessionalId(),
            type,
            amount,
            referenceId,
            after.getOutstandingCommissions(),
            after.getPendingRevenueShares(),
            after.getNetBalance(),
            Instant.now()
        );
    }
}
