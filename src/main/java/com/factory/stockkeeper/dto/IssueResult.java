package com.factory.stockkeeper.dto;

import java.math.BigDecimal;
import java.util.List;

public record IssueResult(String issueNo, String groupId, List<IssuedMaterial> details) {

    public record IssuedMaterial(String materialName, BigDecimal quantity, String uom) {
    }
}
