package com.flagship.settlement_engine.commission.event;

import com.flagship.settlement_engine.commission.CommissionFact;
import com.flagship.settlement_engine.commission.JobCompletion;
import com.flagship.settlement_engine.common.SettlementEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once per job when its commission facts are recorded.
 */
@Value
public class CommissionRecordedEvent implements SettlementEvent {
    UUID eventId;
    String jobId;
    String payerProfessionalId;
    BigDecimal jobValue;
    BigDecimal totalCommission;
    List<Share> shares;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CommissionRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return jobId;
    }

    public static CommissionRecordedEvent from(JobCompletion job, List<CommissionFact> facts) {
        List<Share> shares = facts.stream()
            .map(f -> new Share(f.getRecipientId(), f.getRecipientType().name(), f.getChainLevel(), f.getAmount()))
            .toList();
        BigDecimal total = facts.stream()
            .map(CommissionFact::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new CommissionRecordedEvent(
            UUID.randomUUID(),
            job.getJobId(),
            job.getProfessionalId(),
            job.getJobValue(),
            total,
            shares,
            Instant.now()
        );
    }

    @Value
    public static class Share {
        String recipientId;
        String recipientType;
        int chainLevel;
        BigDecimal amount;
    }
}
