package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

public record LowStockRow(
        Long productId,
        String productName,
        String warehouse,
        BigDecimal currentStock,
        BigDecimal minStock,
        BigDecimal shortage) {
}
