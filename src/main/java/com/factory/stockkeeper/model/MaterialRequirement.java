package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;

/**
 * One exploded BOM line materialised for an order. Only issuance mutates it, and
 * {@code 0 <= issuedQty <= requiredQty} holds at all times.
 */
@Entity
@Table(name = "manufacturing_order_materials")
@Data
public class MaterialRequirement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "order_id", nullable = false)
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private ManufacturingOrder order;

    @ManyToOne
    @JoinColumn(name = "material_id", nullable = false)
    private Product material;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal requiredQty;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal issuedQty = BigDecimal.ZERO;

    @Column(nullable = false, length = 20)
    private String uom;

    @Enumerated(EnumType.STRING)
    private MaterialType materialType;

    @ManyToOne
    @JoinColumn(name = "warehouse_id", nullable = false)
    private Warehouse warehouse;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequirementStatus status = RequirementStatus.PENDING;

    public BigDecimal getOutstandingQty() {
        return requiredQty.subtract(issuedQty);
    }

    public void recordIssued(BigDecimal qty) {
        BigDecimal newIssued = issuedQty.add(qty);
        if (qty.signum() < 0 || newIssued.compareTo(requiredQty) > 0) {
            throw new IllegalStateException("Issued quantity " + newIssued + " would exceed required "
                    + requiredQty + " for material " + material.getCode());
        }
        issuedQty = newIssued;
        if (issuedQty.compareTo(requiredQty) == 0) {
            status = RequirementStatus.ISSUED;
        }
    }
}
