package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.ExpiryStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExpiryReportRow(
        String productName,
        String batchNo,
        String warehouse,
        BigDecimal quantity,
        LocalDate expiryDate,
        ExpiryStatus expiryStatus,
        long daysToExpiry) {
}
