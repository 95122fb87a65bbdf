package com.flagship.settlement_engine.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementErrorRepository extends JpaRepository<SettlementErrorEntity, UUID> {

    List<SettlementErrorEntity> findByRunIdOrderByOccurredAtAsc(UUID runId);
}
