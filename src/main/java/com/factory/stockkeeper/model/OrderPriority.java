package com.factory.stockkeeper.model;

public enum OrderPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
