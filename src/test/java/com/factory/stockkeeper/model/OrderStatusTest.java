package com.factory.stockkeeper.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrderStatusTest {

    @Test
    void confirmedCanStartOrCancel() {
        assertTrue(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.IN_PROGRESS));
        assertTrue(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.CANCELLED));
        assertFalse(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.COMPLETED));
    }

    @Test
    void inProgressCanCompleteCancelOrIssueAgain() {
        assertTrue(OrderStatus.IN_PROGRESS.canTransitionTo(OrderStatus.COMPLETED));
        assertTrue(OrderStatus.IN_PROGRESS.canTransitionTo(OrderStatus.CANCELLED));
        assertTrue(OrderStatus.IN_PROGRESS.canTransitionTo(OrderStatus.IN_PROGRESS));
        assertFalse(OrderStatus.IN_PROGRESS.canTransitionTo(OrderStatus.CONFIRMED));
    }

    @Test
    void terminalStatesGoNowhere() {
        for (OrderStatus target : OrderStatus.values()) {
            assertFalse(OrderStatus.COMPLETED.canTransitionTo(target));
            assertFalse(OrderStatus.CANCELLED.canTransitionTo(target));
        }
        assertTrue(OrderStatus.COMPLETED.isTerminal());
        assertFalse(OrderStatus.IN_PROGRESS.isTerminal());
    }

    @Test
    void bomStatusTransitions() {
        assertTrue(BomStatus.DRAFT.canTransitionTo(BomStatus.ACTIVE));
        assertTrue(BomStatus.ACTIVE.canTransitionTo(BomStatus.INACTIVE));
        assertTrue(BomStatus.INACTIVE.canTransitionTo(BomStatus.ACTIVE));
        assertFalse(BomStatus.ACTIVE.canTransitionTo(BomStatus.DRAFT));
    }
}
