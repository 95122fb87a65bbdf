package com.flagship.settlement_engine.commission;

/**
 * Kind of job a commission is charged on.
 */
public enum CommissionType {
    /** Job won directly from a customer; the platform takes its cut. */
    CUSTOMER_JOB,
    /** Job passed on by another professional; referrers share in the commission. */
    REFERRAL_JOB
}
