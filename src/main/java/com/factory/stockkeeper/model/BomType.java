package com.factory.stockkeeper.model;

public enum BomType {
    KITTING,
    CUTTING,
    REPACKING;

    public String codePrefix() {
        return "BOM-" + name().substring(0, 3);
    }
}
