package com.flagship.settlement_engine.commission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CommissionFactRepository extends JpaRepository<CommissionFactEntity, UUID> {

    boolean existsByJobId(String jobId);

    @Query("""
        SELECT f FROM CommissionFactEntity f
        WHERE f.jobId = :jobId
        ORDER BY f.recipientType DESC, f.chainLevel ASC
        """)
    List<CommissionFactEntity> findByJobId(@Param("jobId") String jobId);

    /**
     * Facts where the professional is either the payer or a referral recipient.
     */
    @Query("""
        SELECT f FROM CommissionFactEntity f
        WHERE f.payerProfessionalId = :professionalId OR f.recipientId = :professionalId
        ORDER BY f.jobCompletedAt DESC, f.chainLevel ASC
        """)
    List<CommissionFactEntity> findInvolving(@Param("professionalId") String professionalId);

    @Query("""
        SELECT f FROM CommissionFactEntity f
        WHERE (f.payerProfessionalId = :professionalId OR f.recipientId = :professionalId)
          AND f.status = :status
        ORDER BY f.jobCompletedAt DESC, f.chainLevel ASC
        """)
    List<CommissionFactEntity> findInvolvingWithStatus(@Param("professionalId") String professionalId,
                                                       @Param("status") CommissionFactStatus status);

    /**
     * Platform commission the professional owes that has not been paid yet.
     */
    @Query("""
        SELECT f FROM CommissionFactEntity f
        WHERE f.payerProfessionalId = :professionalId
          AND f.recipientType = com.flagship.settlement_engine.commission.RecipientType.PLATFORM
          AND f.status <> com.flagship.settlement_engine.commission.CommissionFactStatus.PAID
        ORDER BY f.jobCompletedAt ASC
        """)
    List<CommissionFactEntity> findUnpaidOwedBy(@Param("professionalId") String professionalId);

    /**
     * Platform facts ready to invoice: still RECORDED, non-zero and completed before the period end.
     */
    @Query("""
        SELECT f FROM CommissionFactEntity f
        WHERE f.payerProfessionalId = :professionalId
          AND f.recipientType = com.flagship.settlement_engine.commission.RecipientType.PLATFORM
          AND f.status = com.flagship.settlement_engine.commission.CommissionFactStatus.RECORDED
          AND f.amount > 0
          AND f.jobCompletedAt < :periodEnd
        ORDER BY f.jobCompletedAt ASC, f.jobId ASC
        """)
    List<CommissionFactEntity> findInvoiceable(@Param("professionalId") String professionalId,
                                               @Param("periodEnd") Instant periodEnd);

    @Query("""
        SELECT f FROM CommissionFactEntity f
        WHERE (f.payerProfessionalId = :professionalId OR f.recipientId = :professionalId)
          AND f.jobCompletedAt >= :from AND f.jobCompletedAt < :to
        ORDER BY f.jobCompletedAt ASC, f.chainLevel ASC
        """)
    List<CommissionFactEntity> findInvolvingBetween(@Param("professionalId") String professionalId,
                                                    @Param("from") Instant from,
                                                    @Param("to") Instant to);

    List<CommissionFactEntity> findByInvoiceId(UUID invoiceId);

    List<CommissionFactEntity> findByIdIn(Collection<UUID> ids);
}
