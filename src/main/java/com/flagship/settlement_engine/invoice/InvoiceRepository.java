package com.flagship.settlement_engine.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    Optional<InvoiceEntity> findByActivePeriodKey(String activePeriodKey);

    List<InvoiceEntity> findByProfessionalIdOrderByPeriodYearDescPeriodMonthDescCreatedAtDesc(String professionalId);

    List<InvoiceEntity> findByStatusAndDueDateBefore(InvoiceStatus status, LocalDate date);

    List<InvoiceEntity> findByStatusInOrderByDueDateAsc(Collection<InvoiceStatus> statuses);

    List<InvoiceEntity> findByProfessionalIdAndStatusIn(String professionalId, Collection<InvoiceStatus> statuses);

    long countByStatus(InvoiceStatus status);
}
