package com.flagship.settlement_engine.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, UUID> {

    List<PayoutEntity> findByStatusInOrderByCreatedAtAsc(Collection<PayoutStatus> statuses);

    List<PayoutEntity> findByProfessionalIdOrderByCreatedAtDesc(String professionalId);

    long countByStatusIn(Collection<PayoutStatus> statuses);
}
