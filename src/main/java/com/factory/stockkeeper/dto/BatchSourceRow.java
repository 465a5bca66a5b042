package com.factory.stockkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BatchSourceRow(
        String materialName,
        BigDecimal quantity,
        String sourceBatch,
        LocalDate sourceExpiry) {
}
