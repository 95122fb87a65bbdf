package com.flagship.settlement_engine.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "balance_offsets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OffsetRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "professional_a_id", nullable = false, updatable = false, length = 64)
    private String professionalAId;

    @Column(name = "professional_b_id", nullable = false, updatable = false, length = 64)
    private String professionalBId;

    @Column(name = "offset_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal offsetAmount;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(name = "processed_by", updatable = false, length = 64)
    private String processedBy;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    static OffsetRecordEntity fromDomain(OffsetRecord offset) {
        return new OffsetRecordEntity(offset.getId(), offset.getProfessionalAId(), offset.getProfessionalBId(),
            offset.getOffsetAmount(), offset.getDescription(), offset.getProcessedBy(), offset.getProcessedAt());
    }

    public OffsetRecord toDomain() {
        return new OffsetRecord(id, professionalAId, professionalBId, offsetAmount, description,
            processedBy, processedAt);
    }
}
