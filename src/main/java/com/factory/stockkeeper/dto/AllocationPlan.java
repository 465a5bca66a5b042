package com.factory.stockkeeper.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of walking the FEFO-ordered lots for a requested quantity. A plan with a
 * shortfall is never executed.
 */
public record AllocationPlan(
        BigDecimal requested,
        List<LotAllocation> allocations,
        BigDecimal allocated,
        BigDecimal available) {

    public BigDecimal getShortfall() {
        BigDecimal shortfall = requested.subtract(allocated);
        return shortfall.signum() > 0 ? shortfall : BigDecimal.ZERO;
    }

    public boolean isSatisfied() {
        return getShortfall().signum() == 0;
    }
}
