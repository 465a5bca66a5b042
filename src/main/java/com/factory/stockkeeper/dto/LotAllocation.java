package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.ExpiryStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record LotAllocation(
        Long lotId,
        String batchNo,
        LocalDate expiryDate,
        ExpiryStatus expiryStatus,
        BigDecimal qtyTaken) {
}
