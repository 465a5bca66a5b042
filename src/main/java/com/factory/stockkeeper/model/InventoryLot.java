package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A row of the inventory ledger. Inbound rows (STOCK_IN, PRODUCTION_IN) are lots whose
 * {@code remain} is the only mutable column and only ever decreases. PRODUCTION_OUT rows
 * record a consumption against {@code sourceLot} and always have {@code remain = 0}.
 */
@Entity
@Table(name = "inventory_lots", indexes = {
        @Index(name = "idx_lot_product_warehouse", columnList = "product_id, warehouse_id"),
        @Index(name = "idx_lot_batch", columnList = "batchNo"),
        @Index(name = "idx_lot_group", columnList = "groupId")
})
@Data
public class InventoryLot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private MovementType movementType;

    @ManyToOne
    @JoinColumn(name = "product_id", nullable = false, updatable = false)
    private Product product;

    @ManyToOne
    @JoinColumn(name = "warehouse_id", nullable = false, updatable = false)
    private Warehouse warehouse;

    // Never negative, the movement type gives the direction
    @Column(nullable = false, precision = 18, scale = 4, updatable = false)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal remain;

    @Column(updatable = false)
    private String batchNo;

    @Column(updatable = false)
    private LocalDate expiryDate;

    @ManyToOne
    @JoinColumn(name = "source_lot_id", updatable = false)
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private InventoryLot sourceLot;

    // Receipt / issue number that produced this row
    @Column(updatable = false)
    private String sourceRef;

    @Column(updatable = false)
    private String groupId;

    @Column(updatable = false)
    private String createdBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private boolean deleted = false;

    @Version
    private Long version;

    public boolean isAvailable() {
        return movementType.isInbound() && !deleted && remain.signum() > 0;
    }

    public void consume(BigDecimal qty) {
        if (qty.signum() <= 0 || qty.compareTo(remain) > 0) {
            throw new IllegalStateException("Cannot take " + qty + " from lot " + id + " with remain " + remain);
        }
        remain = remain.subtract(qty);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
