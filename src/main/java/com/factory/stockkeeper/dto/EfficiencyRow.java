package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.BomType;

import java.math.BigDecimal;

public record EfficiencyRow(
        BomType bomType,
        long completedOrders,
        BigDecimal plannedQty,
        BigDecimal producedQty,
        double efficiencyPct) {
}
