package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.BomHeader;
import com.factory.stockkeeper.model.BomStatus;
import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.model.MaterialType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record BomView(
        Long id,
        String bomCode,
        String bomName,
        BomType bomType,
        BomStatus status,
        Integer version,
        String productCode,
        String productName,
        BigDecimal outputQty,
        String uom,
        LocalDate effectiveDate,
        List<LineView> lines) {

    public record LineView(Long materialId, String materialName, MaterialType materialType,
            BigDecimal quantity, String uom, BigDecimal scrapRate) {
    }

    public static BomView from(BomHeader bom) {
        List<LineView> lines = bom.getLines().stream()
                .map(l -> new LineView(l.getMaterial().getId(), l.getMaterial().getName(), l.getMaterialType(),
                        l.getQuantity(), l.getUom(), l.getScrapRate()))
                .toList();
        return new BomView(bom.getId(), bom.getBomCode(), bom.getBomName(), bom.getBomType(), bom.getStatus(),
                bom.getVersion(), bom.getProduct().getCode(), bom.getProduct().getName(), bom.getOutputQty(),
                bom.getUom(), bom.getEffectiveDate(), lines);
    }
}
