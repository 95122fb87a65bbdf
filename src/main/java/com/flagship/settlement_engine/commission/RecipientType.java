package com.flagship.settlement_engine.commission;

public enum RecipientType {
    PLATFORM,
    REFERRER;

    /** Recipient id used on facts owed to the platform itself. */
    public static final String PLATFORM_RECIPIENT_ID = "PLATFORM";
}
