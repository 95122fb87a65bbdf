package com.flagship.settlement_engine.settlement;

import com.flagship.settlement_engine.invoice.Invoice;
import lombok.Value;

import java.util.List;

/**
 * Invoices created by a monthly run together with its report.
 */
@Value
public class MonthlySettlement {
    List<Invoice> invoices;
    SettlementReport report;
}
