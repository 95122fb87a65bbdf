package com.flagship.settlement_engine.settlement.event;

import com.flagship.settlement_engine.common.SettlementEvent;
import com.flagship.settlement_engine.settlement.Payout;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PayoutCreatedEvent implements SettlementEvent {
    UUID eventId;
    UUID payoutId;
    String professionalId;
    BigDecimal amount;
    String payoutMethod;
    String status;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return payoutId.toString();
    }

    public static PayoutCreatedEvent fromPayout(Payout payout) {
        return new PayoutCreatedEvent(
            UUID.randomUUID(),
            payout.getId(),
            payout.getProfessionalId(),
            payout.getAmount(),
            payout.getMethod().name(),
            payout.getStatus().name(),
            payout.getCreatedBy(),
            Instant.now()
        );
    }
}
