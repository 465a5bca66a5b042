package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "production_receipts")
@Data
public class ProductionReceipt {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String receiptNo;

    @ManyToOne
    @JoinColumn(name = "order_id", nullable = false)
    private ManufacturingOrder order;

    @Column(nullable = false)
    private LocalDateTime receiptDate;

    @ManyToOne
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(length = 20)
    private String uom;

    @Column(nullable = false)
    private String batchNo;

    private LocalDate expiryDate;

    @ManyToOne
    @JoinColumn(name = "warehouse_id", nullable = false)
    private Warehouse warehouse;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QualityStatus qualityStatus;

    @OneToOne
    @JoinColumn(name = "lot_id")
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private InventoryLot lot;

    @Column(length = 1000)
    private String notes;

    private String createdBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (receiptDate == null)
            receiptDate = createdAt;
    }
}
