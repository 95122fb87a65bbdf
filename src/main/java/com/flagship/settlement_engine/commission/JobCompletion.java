package com.flagship.settlement_engine.commission;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A completed job, as reported over REST or by a JobCompleted event.
 */
@Value
@Builder
public class JobCompletion {
    String jobId;
    /** The professional who did the job and owes the commission. */
    String professionalId;
    BigDecimal jobValue;
    CommissionType commissionType;
    String category;
    /** Overrides the configured default rate when present. */
    BigDecimal commissionRate;
    String referrerId;
    /** For referral jobs, the share rate agreed with the referrer; wins over commissionRate. */
    BigDecimal referrerShareRate;
    /** Defaults to the time of recording. */
    Instant completedAt;
    String recordedBy;
}
