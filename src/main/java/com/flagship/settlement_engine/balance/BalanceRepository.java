package com.flagship.settlement_engine.balance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface BalanceRepository extends JpaRepository<BalanceEntity, String> {

    @Query("""
        SELECT b.professionalId FROM BalanceEntity b
        WHERE b.outstandingCommissions > 0
        ORDER BY b.professionalId
        """)
    List<String> findProfessionalIdsWithOutstandingCommissions();

    @Query("""
        SELECT b FROM BalanceEntity b
        WHERE b.outstandingCommissions > 0
        ORDER BY b.professionalId
        """)
    List<BalanceEntity> findWithOutstandingCommissions();

    List<BalanceEntity> findAllByOrderByProfessionalIdAsc();

    @Query("SELECT COALESCE(SUM(b.outstandingCommissions), 0) FROM BalanceEntity b")
    BigDecimal sumOutstandingCommissions();
}
