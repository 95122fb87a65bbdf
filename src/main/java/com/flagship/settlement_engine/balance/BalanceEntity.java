package com.flagship.settlement_engine.balance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for the balances table.
 *
 * No setters: the three money columns are only ever written together from a
 * {@link Balance}, which derives the net value. The version column catches any
 * writer that slips past the per-professional lock.
 */
@Entity
@Table(name = "balances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BalanceEntity {

    @Id
    @Column(name = "professional_id", nullable = false, updatable = false, length = 64)
    private String professionalId;

    @Column(name = "outstanding_commissions", nullable = false, precision = 19, scale = 2)
    private BigDecimal outstandingCommissions;

    @Column(name = "pending_revenue_shares", nullable = false, precision = 19, scale = 2)
    private BigDecimal pendingRevenueShares;

    @Column(name = "net_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal netBalance;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Column(name = "autopay_enabled", nullable = false)
    private boolean autopayEnabled;

    @Column(name = "autopay_payment_method_id", length = 128)
    private String autopayPaymentMethodId;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    static BalanceEntity fromDomain(Balance balance) {
        return new BalanceEntity(
            balance.getProfessionalId(),
            balance.getOutstandingCommissions(),
            balance.getPendingRevenueShares(),
            balance.getNetBalance(),
            balance.getLastUpdated(),
            balance.isAutopayEnabled(),
            balance.getAutopayPaymentMethodId(),
            null  // version - assigned on persist
        );
    }

    public Balance toDomain() {
        return Balance.restore(
            professionalId,
            outstandingCommissions,
            pendingRevenueShares,
            lastUpdated,
            autopayEnabled,
            autopayPaymentMethodId
        );
    }

    void updateFromDomain(Balance balance) {
        if (!balance.getProfessionalId().equals(this.professionalId)) {
            throw new IllegalArgumentException(
                "Cannot update balance " + professionalId + " from " + balance.getProfessionalId());
        }
        this.outstandingCommissions = balance.getOutstandingCommissions();
        this.pendingRevenueShares = balance.getPendingRevenueShares();
        this.netBalance = balance.getNetBalance();
        this.lastUpdated = balance.getLastUpdated();
        this.autopayEnabled = balance.isAutopayEnabled();
        this.autopayPaymentMethodId = balance.getAutopayPaymentMethodId();
    }
}
