package com.factory.stockkeeper.model;

/**
 * Kind of ledger row. Inbound rows create a lot with a balance; outbound rows record a
 * consumption against a source lot and never carry a balance of their own.
 */
public enum MovementType {
    STOCK_IN(true),
    PRODUCTION_IN(true),
    PRODUCTION_OUT(false);

    private final boolean inbound;

    MovementType(boolean inbound) {
        this.inbound = inbound;
    }

    public boolean isInbound() {
        return inbound;
    }
}
