package com.flagship.settlement_engine.payment;

import com.flagship.settlement_engine.gateway.GatewayProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    boolean existsByInvoiceIdAndStatus(UUID invoiceId, PaymentStatus status);

    Optional<PaymentEntity> findByGatewayProviderAndGatewayTransactionId(GatewayProvider provider,
                                                                         String gatewayTransactionId);

    List<PaymentEntity> findByInvoiceIdOrderByCreatedAtDesc(UUID invoiceId);

    long countByStatus(PaymentStatus status);
}
