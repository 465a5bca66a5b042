package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.ExpiryStatus;
import com.factory.stockkeeper.model.MovementType;

import java.math.BigDecimal;
import java.time.LocalDate;

public record LotBalanceRow(
        Long lotId,
        String batchNo,
        MovementType movementType,
        BigDecimal quantity,
        BigDecimal remain,
        LocalDate expiryDate,
        ExpiryStatus expiryStatus,
        Long daysToExpiry) {
}
