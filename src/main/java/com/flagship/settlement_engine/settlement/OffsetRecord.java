package com.flagship.settlement_engine.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit row of a netting between two professionals: A gave up {@code offsetAmount}
 * of revenue shares and B's commission debt dropped by the same amount.
 */
@Value
public class OffsetRecord {
    UUID id;
    String professionalAId;
    String professionalBId;
    BigDecimal offsetAmount;
    String description;
    String processedBy;
    Instant processedAt;

    public static OffsetRecord of(String professionalAId, String professionalBId, BigDecimal amount,
                                  String description, String processedBy, Instant now) {
        return new OffsetRecord(UUID.randomUUID(), professionalAId, professionalBId, amount,
            description, processedBy, now);
    }
}
