package com.factory.stockkeeper.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Manufacturing order lifecycle. Orders move forward only; CANCELLED is the single branch
 * and, like COMPLETED, is terminal.
 */
public enum OrderStatus {
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public Set<OrderStatus> allowedTargets() {
        switch (this) {
            case CONFIRMED:
                return EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS:
                return EnumSet.of(IN_PROGRESS, COMPLETED, CANCELLED);
            default:
                return EnumSet.noneOf(OrderStatus.class);
        }
    }

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
