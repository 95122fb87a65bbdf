package com.flagship.settlement_engine.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AutopayAttemptRepository extends JpaRepository<AutopayAttemptEntity, UUID> {

    List<AutopayAttemptEntity> findByProfessionalId(String professionalId);
}
