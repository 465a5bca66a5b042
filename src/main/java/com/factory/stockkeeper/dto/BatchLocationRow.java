package com.factory.stockkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record BatchLocationRow(
        String warehouse,
        BigDecimal remainingQty,
        String status,
        LocalDateTime lastUpdated) {
}
