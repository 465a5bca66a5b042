package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.MaterialRequirement;
import com.factory.stockkeeper.model.RequirementStatus;

import java.math.BigDecimal;

public record RequirementView(
        Long id,
        Long materialId,
        String materialCode,
        String materialName,
        BigDecimal requiredQty,
        BigDecimal issuedQty,
        String uom,
        RequirementStatus status) {

    public static RequirementView from(MaterialRequirement requirement) {
        return new RequirementView(
                requirement.getId(),
                requirement.getMaterial().getId(),
                requirement.getMaterial().getCode(),
                requirement.getMaterial().getName(),
                requirement.getRequiredQty(),
                requirement.getIssuedQty(),
                requirement.getUom(),
                requirement.getStatus());
    }
}
