package com.flagship.settlement_engine.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "refunds")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RefundEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_id", nullable = false, updatable = false)
    private UUID paymentId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(updatable = false, length = 500)
    private String reason;

    @Column(name = "gateway_refund_id", updatable = false, length = 128)
    private String gatewayRefundId;

    @Column(name = "processed_by", updatable = false, length = 64)
    private String processedBy;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    static RefundEntity fromDomain(Refund refund) {
        return new RefundEntity(refund.getId(), refund.getPaymentId(), refund.getAmount(), refund.getReason(),
            refund.getGatewayRefundId(), refund.getProcessedBy(), refund.getProcessedAt());
    }

    public Refund toDomain() {
        return new Refund(id, paymentId, amount, reason, gatewayRefundId, processedBy, processedAt);
    }
}
