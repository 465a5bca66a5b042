package com.factory.stockkeeper.model;

public enum MaterialType {
    RAW_MATERIAL,
    PACKAGING,
    CONSUMABLE
}
