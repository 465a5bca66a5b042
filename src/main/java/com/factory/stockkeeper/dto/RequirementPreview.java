package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

public record RequirementPreview(
        Long materialId,
        String materialName,
        BigDecimal outstandingQty,
        String uom,
        AllocationPlan plan) {
}
