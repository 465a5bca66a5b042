package com.factory.stockkeeper.model;

public enum IssueStatus {
    CONFIRMED,
    CANCELLED
}
