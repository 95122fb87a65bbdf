package com.flagship.settlement_engine.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OffsetRecordRepository extends JpaRepository<OffsetRecordEntity, UUID> {

    @Query("SELECT o FROM OffsetRecordEntity o " +
           "WHERE o.professionalAId = :professionalId OR o.professionalBId = :professionalId " +
           "ORDER BY o.processedAt ASC")
    List<OffsetRecordEntity> findInvolving(@Param("professionalId") String professionalId);
}
