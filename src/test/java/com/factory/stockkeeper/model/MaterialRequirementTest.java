package com.factory.stockkeeper.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MaterialRequirementTest {

    @Test
    void recordIssued_marksIssuedWhenFullyCovered() {
        MaterialRequirement requirement = requirement("10");

        requirement.recordIssued(new BigDecimal("4"));
        assertEquals(RequirementStatus.PENDING, requirement.getStatus());
        assertEquals(0, new BigDecimal("6").compareTo(requirement.getOutstandingQty()));

        requirement.recordIssued(new BigDecimal("6"));
        assertEquals(RequirementStatus.ISSUED, requirement.getStatus());
    }

    @Test
    void recordIssued_neverExceedsRequired() {
        MaterialRequirement requirement = requirement("10");

        assertThrows(IllegalStateException.class, () -> requirement.recordIssued(new BigDecimal("10.0001")));
        assertThrows(IllegalStateException.class, () -> requirement.recordIssued(new BigDecimal("-1")));
        assertEquals(0, BigDecimal.ZERO.compareTo(requirement.getIssuedQty()));
    }

    @Test
    void lotConsume_neverGoesNegative() {
        InventoryLot lot = new InventoryLot();
        lot.setRemain(new BigDecimal("3"));

        assertThrows(IllegalStateException.class, () -> lot.consume(new BigDecimal("4")));
        assertThrows(IllegalStateException.class, () -> lot.consume(BigDecimal.ZERO));
        lot.consume(new BigDecimal("3"));
        assertEquals(0, BigDecimal.ZERO.compareTo(lot.getRemain()));
    }

    private static MaterialRequirement requirement(String required) {
        Product material = new Product();
        material.setCode("RM-1");
        MaterialRequirement requirement = new MaterialRequirement();
        requirement.setMaterial(material);
        requirement.setRequiredQty(new BigDecimal(required));
        return requirement;
    }
}
