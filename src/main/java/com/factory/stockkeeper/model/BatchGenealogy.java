package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Edge of the traceability graph: {@code quantity} of {@code consumedLot} went into
 * {@code outputOrder}. {@code producedLot} is filled in once the order completes.
 */
@Entity
@Table(name = "batch_genealogy", indexes = {
        @Index(name = "idx_genealogy_order", columnList = "output_order_id"),
        @Index(name = "idx_genealogy_consumed", columnList = "consumed_lot_id")
})
@Data
public class BatchGenealogy {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "output_order_id", nullable = false)
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private ManufacturingOrder outputOrder;

    @ManyToOne
    @JoinColumn(name = "consumed_lot_id", nullable = false)
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private InventoryLot consumedLot;

    @ManyToOne
    @JoinColumn(name = "produced_lot_id")
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private InventoryLot producedLot;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false)
    private String groupId;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
