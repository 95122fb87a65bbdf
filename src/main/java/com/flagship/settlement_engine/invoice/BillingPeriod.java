package com.flagship.settlement_engine.invoice;

import com.flagship.settlement_engine.exception.ValidationException;
import lombok.Value;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * A calendar month in the settlement zone. A job belongs to the first period
 * whose end is after its completion time.
 */
@Value
public class BillingPeriod {
    int month;
    int year;

    public static BillingPeriod of(int month, int year) {
        if (month < 1 || month > 12) {
            throw new ValidationException("month must be between 1 and 12, got " + month);
        }
        if (year < 2000 || year > 9999) {
            throw new ValidationException("year out of range: " + year);
        }
        return new BillingPeriod(month, year);
    }

    public Instant start(ZoneId zone) {
        return YearMonth.of(year, month).atDay(1).atStartOfDay(zone).toInstant();
    }

    /**
     * Exclusive end: midnight at the start of the following month.
     */
    public Instant end(ZoneId zone) {
        return YearMonth.of(year, month).plusMonths(1).atDay(1).atStartOfDay(zone).toInstant();
    }

    /**
     * Value of the unique active_period_key column while an invoice for this period is not cancelled.
     */
    public String activeKey(String professionalId) {
        return professionalId + "|" + year + "|" + month;
    }

    public String numberPrefix() {
        return String.format("INV-%04d%02d-", year, month);
    }
}
