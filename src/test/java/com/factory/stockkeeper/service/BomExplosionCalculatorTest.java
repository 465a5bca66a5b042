package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.MaterialRequirementLine;
import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BomExplosionCalculatorTest {

    private final BomExplosionCalculator calculator = new BomExplosionCalculator();

    @Test
    void explode_addsScrapOverage() {
        BomHeader bom = bom(BomStatus.ACTIVE, line(1L, "2", "5"));

        List<MaterialRequirementLine> lines = calculator.explode(bom, BigDecimal.TEN, true);

        assertEquals(1, lines.size());
        assertEquals(new BigDecimal("21.0000"), lines.get(0).requiredQty());
        assertEquals("KG", lines.get(0).uom());
    }

    @Test
    void explode_treatsMissingScrapAsZero() {
        BomLine line = line(1L, "0.25", "0");
        line.setScrapRate(null);

        List<MaterialRequirementLine> lines = calculator.explode(bom(BomStatus.ACTIVE, line), new BigDecimal("3"), true);

        assertEquals(new BigDecimal("0.7500"), lines.get(0).requiredQty());
    }

    @Test
    void explode_keepsLineOrder() {
        BomHeader bom = bom(BomStatus.ACTIVE, line(1L, "1", "0"), line(2L, "3", "10"));

        List<MaterialRequirementLine> lines = calculator.explode(bom, new BigDecimal("2"), true);

        assertEquals(1L, lines.get(0).materialId());
        assertEquals(2L, lines.get(1).materialId());
        assertEquals(new BigDecimal("6.6000"), lines.get(1).requiredQty());
    }

    @Test
    void explode_rejectsNonPositiveTarget() {
        BomHeader bom = bom(BomStatus.ACTIVE, line(1L, "1", "0"));

        assertThrows(ValidationException.class, () -> calculator.explode(bom, BigDecimal.ZERO, true));
        assertThrows(ValidationException.class, () -> calculator.explode(bom, new BigDecimal("-1"), true));
        assertThrows(ValidationException.class, () -> calculator.explode(bom, null, true));
    }

    @Test
    void explode_inactiveRecipeOnlyWhenPolicyAllows() {
        BomHeader draft = bom(BomStatus.DRAFT, line(1L, "1", "0"));

        assertThrows(NotFoundException.class, () -> calculator.explode(draft, BigDecimal.ONE, true));
        assertEquals(1, calculator.explode(draft, BigDecimal.ONE, false).size());
    }

    @Test
    void explode_recipeWithoutLinesIsNotFound() {
        assertThrows(NotFoundException.class, () -> calculator.explode(bom(BomStatus.ACTIVE), BigDecimal.ONE, false));
    }

    private static BomHeader bom(BomStatus status, BomLine... lines) {
        BomHeader bom = new BomHeader();
        bom.setBomCode("BOM-KIT-0001");
        bom.setBomType(BomType.KITTING);
        bom.setStatus(status);
        for (BomLine line : lines) {
            bom.addLine(line);
        }
        return bom;
    }

    private static BomLine line(Long materialId, String qty, String scrap) {
        Product material = new Product();
        material.setId(materialId);
        material.setCode("RM-" + materialId);
        material.setName("Material " + materialId);
        BomLine line = new BomLine();
        line.setMaterial(material);
        line.setMaterialType(MaterialType.RAW_MATERIAL);
        line.setQuantity(new BigDecimal(qty));
        line.setScrapRate(new BigDecimal(scrap));
        line.setUom("KG");
        return line;
    }
}
