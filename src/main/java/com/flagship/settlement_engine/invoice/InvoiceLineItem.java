package com.flagship.settlement_engine.invoice;

import com.flagship.settlement_engine.commission.CommissionFact;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class InvoiceLineItem {
    UUID commissionFactId;
    String jobId;
    String description;
    BigDecimal amount;

    public static InvoiceLineItem of(CommissionFact fact) {
        return new InvoiceLineItem(fact.getId(), fact.getJobId(),
            "Platform commission for job " + fact.getJobId() + " (" + fact.getCategory() + ")",
            fact.getAmount());
    }
}
