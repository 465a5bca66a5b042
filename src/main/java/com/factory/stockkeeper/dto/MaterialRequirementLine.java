package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.MaterialType;

import java.math.BigDecimal;

public record MaterialRequirementLine(
        Long materialId,
        String materialCode,
        String materialName,
        BigDecimal requiredQty,
        String uom,
        MaterialType materialType) {
}
