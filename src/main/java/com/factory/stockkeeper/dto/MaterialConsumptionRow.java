package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

public record MaterialConsumptionRow(
        String materialName,
        BigDecimal totalConsumed,
        String uom,
        long orderCount,
        BigDecimal avgDaily) {
}
