package com.flagship.settlement_engine.commission;

import com.flagship.settlement_engine.commission.calculator.CommissionBreakdown;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Allocations for one job together with the breakdown they were derived from.
 * The ledger refuses a plan whose allocations do not add up to the breakdown total.
 */
@Value
public class CommissionPlan {
    CommissionBreakdown breakdown;
    List<CommissionAllocation> allocations;

    public BigDecimal allocatedTotal() {
        return allocations.stream()
            .map(CommissionAllocation::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
