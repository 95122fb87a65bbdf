package com.flagship.settlement_engine.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RefundRepository extends JpaRepository<RefundEntity, UUID> {

    List<RefundEntity> findByPaymentIdOrderByProcessedAtAsc(UUID paymentId);
}
