package com.flagship.settlement_engine.balance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BalanceMovementRepository extends JpaRepository<BalanceMovementEntity, UUID> {

    List<BalanceMovementEntity> findByProfessionalIdOrderByCreatedAtAsc(String professionalId);

    long countByProfessionalId(String professionalId);
}
