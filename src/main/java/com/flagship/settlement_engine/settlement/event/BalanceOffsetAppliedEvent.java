package com.flagship.settlement_engine.settlement.event;

import com.flagship.settlement_engine.common.SettlementEvent;
import com.flagship.settlement_engine.settlement.OffsetRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Both professionals are notified: A's revenue shares and B's debt dropped by the same amount.
 */
@Value
public class BalanceOffsetAppliedEvent implements SettlementEvent {
    UUID eventId;
    UUID offsetId;
    String professionalAId;
    String professionalBId;
    BigDecimal offsetAmount;
    String description;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceOffsetApplied";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return offsetId.toString();
    }

    public static BalanceOffsetAppliedEvent fromOffset(OffsetRecord offset) {
        return new BalanceOffsetAppliedEvent(
            UUID.randomUUID(),
            offset.getId(),
            offset.getProfessionalAId(),
            offset.getProfessionalBId(),
            offset.getOffsetAmount(),
            offset.getDescription(),
            Instant.now()
        );
    }
}
