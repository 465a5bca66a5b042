package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

// warehouseId is null for the balance across all warehouses
public record StockBalanceView(Long productId, Long warehouseId, BigDecimal balance) {
}
