package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.MaterialRequirementLine;
import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.BomHeader;
import com.factory.stockkeeper.model.BomLine;
import com.factory.stockkeeper.model.BomStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Turns a recipe and a target output quantity into the flat list of materials needed.
 * {@code required = qtyPerUnit * target * (1 + scrapRate / 100)}, rounded to 4 decimals.
 * Has no side effects.
 */
@Component
public class BomExplosionCalculator {

    public static final int QTY_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public List<MaterialRequirementLine> explode(BomHeader bom, BigDecimal targetQty, boolean requireActive) {
        if (bom == null) {
            throw new NotFoundException("BOM not found");
        }
        if (targetQty == null || targetQty.signum() <= 0) {
            throw new ValidationException("Target quantity must be greater than zero");
        }
        if (requireActive && bom.getStatus() != BomStatus.ACTIVE) {
            throw new NotFoundException("No active BOM " + bom.getBomCode() + " (status " + bom.getStatus() + ")");
        }
        if (bom.getLines() == null || bom.getLines().isEmpty()) {
            throw new NotFoundException("BOM " + bom.getBomCode() + " has no materials");
        }

        return bom.getLines().stream()
                .map(line -> new MaterialRequirementLine(
                        line.getMaterial().getId(),
                        line.getMaterial().getCode(),
                        line.getMaterial().getName(),
                        requiredQty(line, targetQty),
                        line.getUom(),
                        line.getMaterialType()))
                .toList();
    }

    static BigDecimal requiredQty(BomLine line, BigDecimal targetQty) {
        BigDecimal scrap = line.getScrapRate() != null ? line.getScrapRate() : BigDecimal.ZERO;
        BigDecimal factor = BigDecimal.ONE.add(scrap.divide(HUNDRED, 10, RoundingMode.HALF_UP));
        return line.getQuantity()
                .multiply(targetQty)
                .multiply(factor)
                .setScale(QTY_SCALE, RoundingMode.HALF_UP);
    }
}
