package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

public record BatchUsageRow(
        String sourceBatch,
        String orderNo,
        String outputProductName,
        String outputBatch,
        BigDecimal quantity) {
}
