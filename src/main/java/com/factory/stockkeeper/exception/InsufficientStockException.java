package com.factory.stockkeeper.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientStockException extends ManufacturingException {

    private final Long materialId;
    private final Long warehouseId;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientStockException(String materialCode, Long materialId, Long warehouseId,
            BigDecimal requested, BigDecimal available) {
        super("Insufficient stock for " + materialCode + " in warehouse " + warehouseId
                + ": requested " + requested.stripTrailingZeros().toPlainString()
                + ", available " + available.stripTrailingZeros().toPlainString());
        this.materialId = materialId;
        this.warehouseId = warehouseId;
        this.requested = requested;
        this.available = available;
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_STOCK";
    }
}
