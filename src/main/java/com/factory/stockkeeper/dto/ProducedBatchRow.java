package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.model.QualityStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record ProducedBatchRow(
        String batchNo,
        LocalDateTime receiptDate,
        String productName,
        BigDecimal quantity,
        LocalDate expiryDate,
        QualityStatus qualityStatus,
        String orderNo,
        BomType bomType) {
}
