package com.factory.stockkeeper.model;

public enum RequirementStatus {
    PENDING,
    ISSUED
}
