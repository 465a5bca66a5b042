package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.BomType;

import java.math.BigDecimal;
import java.util.List;

public record MaterialUsageRow(
        Long materialId,
        String materialName,
        long usageCount,
        BigDecimal totalQuantity,
        List<BomType> bomTypes) {
}
