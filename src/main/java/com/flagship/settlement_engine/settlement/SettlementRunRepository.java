package com.flagship.settlement_engine.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementRunRepository extends JpaRepository<SettlementRunEntity, UUID> {

    List<SettlementRunEntity> findByPeriodYearAndPeriodMonthOrderByStartedAtDesc(int periodYear, int periodMonth);
}
