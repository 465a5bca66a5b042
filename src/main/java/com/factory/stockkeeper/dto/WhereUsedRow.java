package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.BomStatus;
import com.factory.stockkeeper.model.MaterialType;

import java.math.BigDecimal;

public record WhereUsedRow(
        Long bomId,
        String bomCode,
        String bomName,
        BomStatus bomStatus,
        String outputProductName,
        BigDecimal quantity,
        String uom,
        MaterialType materialType) {
}
