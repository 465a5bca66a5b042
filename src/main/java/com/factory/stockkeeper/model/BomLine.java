package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;

@Entity
@Table(name = "bom_lines")
@Data
public class BomLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "bom_id", nullable = false)
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private BomHeader bom;

    @ManyToOne
    @JoinColumn(name = "material_id", nullable = false)
    private Product material;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MaterialType materialType;

    // Quantity per one unit of output
    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, length = 20)
    private String uom;

    // Percent, e.g. 5.00 = 5% overage
    @Column(precision = 7, scale = 2)
    private BigDecimal scrapRate = BigDecimal.ZERO;
}
