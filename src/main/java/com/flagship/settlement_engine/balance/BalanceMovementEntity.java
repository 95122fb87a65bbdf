package com.flagship.settlement_engine.balance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only journal row. Nothing updates or deletes these.
 */
@Entity
@Table(name = "balance_movements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BalanceMovementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "movement_type", nullable = false, updatable = false, length = 40)
    private MovementType movementType;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "reference_id", updatable = false)
    private UUID referenceId;

    @Column(name = "outstanding_after", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal outstandingAfter;

    @Column(name = "pending_after", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal pendingAfter;

    @Column(name = "net_after", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal netAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BalanceMovementEntity fromDomain(BalanceMovement movement) {
        return new BalanceMovementEntity(
            movement.getId(),
            movement.getProfessionalId(),
            movement.getMovementType(),
            movement.getAmount(),
            movement.getReferenceId(),
            movement.getOutstandingAfter(),
            movement.getPendingAfter(),
            movement.getNetAfter(),
            movement.getCreatedAt()
        );
    }

    public BalanceMovement toDomain() {
        return new BalanceMovement(id, professionalId, movementType, amount, referenceId,
            outstandingAfter, pendingAfter, netAfter, createdAt);
    }
}
