package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

public record AvailabilityRow(
        Long materialId,
        String materialName,
        BigDecimal required,
        BigDecimal available,
        String uom,
        boolean sufficient) {
}
