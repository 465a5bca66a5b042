package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

public record ProductionImpactRow(
        Long productId,
        String productName,
        BigDecimal produced,
        BigDecimal consumed,
        BigDecimal netChange) {
}
