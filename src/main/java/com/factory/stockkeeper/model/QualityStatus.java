package com.factory.stockkeeper.model;

public enum QualityStatus {
    PASSED,
    PENDING,
    FAILED
}
