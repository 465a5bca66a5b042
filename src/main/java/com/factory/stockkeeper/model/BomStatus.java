package com.factory.stockkeeper.model;

public enum BomStatus {
    DRAFT,
    ACTIVE,
    INACTIVE;

    public boolean canTransitionTo(BomStatus target) {
        switch (this) {
            case DRAFT:
                return target == ACTIVE || target == INACTIVE;
            case ACTIVE:
                return target == INACTIVE;
            case INACTIVE:
                return target == ACTIVE;
            default:
                return false;
        }
    }
}
