package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum PayoutMethod {
    BANK_TRANSFER,
    CREDIT_TO_NEXT_INVOICE,
    MANUAL_CHECK;

    /**
     * Methods that move real money are subject to the payout minimum.
     */
    public boolean requiresMinimum() {
        return this != CREDIT_TO_NEXT_INVOICE;
    }

    public static PayoutMethod fromValue(String value) {
        if (value == null) {
            throw new ValidationException("payout_method is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown payout_method '" + value + "', expected one of "
                + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
        }
    }
}
