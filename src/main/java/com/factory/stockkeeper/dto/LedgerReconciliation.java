package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

/**
 * Balance of one product in one warehouse computed two ways: from the movements
 * (receipts minus consumptions) and from the open lots.
 */
public record LedgerReconciliation(
        Long productId,
        Long warehouseId,
        BigDecimal received,
        BigDecimal consumed,
        BigDecimal lotBalance) {

    public BigDecimal getMovementBalance() {
        return received.subtract(consumed);
    }

    public boolean isConsistent() {
        return getMovementBalance().compareTo(lotBalance) == 0;
    }
}
