package com.factory.stockkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record BatchInfo(
        String batchNo,
        Long productId,
        String productCode,
        String productName,
        BigDecimal quantity,
        String uom,
        LocalDate expiryDate,
        LocalDateTime createdAt,
        String warehouse) {
}
