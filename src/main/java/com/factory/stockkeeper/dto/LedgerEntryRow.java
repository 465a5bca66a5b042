package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.InventoryLot;
import com.factory.stockkeeper.model.MovementType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record LedgerEntryRow(
        Long id,
        MovementType movementType,
        String batchNo,
        BigDecimal quantity,
        BigDecimal remain,
        LocalDate expiryDate,
        Long sourceLotId,
        String sourceRef,
        String groupId,
        String createdBy,
        LocalDateTime createdAt) {

    public static LedgerEntryRow from(InventoryLot lot) {
        return new LedgerEntryRow(lot.getId(), lot.getMovementType(), lot.getBatchNo(), lot.getQuantity(),
                lot.getRemain(), lot.getExpiryDate(),
                lot.getSourceLot() != null ? lot.getSourceLot().getId() : null,
                lot.getSourceRef(), lot.getGroupId(), lot.getCreatedBy(), lot.getCreatedAt());
    }
}
