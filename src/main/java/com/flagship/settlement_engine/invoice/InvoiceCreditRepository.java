package com.flagship.settlement_engine.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InvoiceCreditRepository extends JpaRepository<InvoiceCreditEntity, UUID> {

    List<InvoiceCreditEntity> findByProfessionalIdAndStatusOrderByCreatedAtAsc(String professionalId,
                                                                             InvoiceCreditStatus status);

    List<InvoiceCreditEntity> findByProfessionalIdOrderByCreatedAtAsc(String professionalId);
}
