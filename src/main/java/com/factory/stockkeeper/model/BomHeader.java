package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "bom_headers")
@Data
public class BomHeader {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String bomCode; // e.g. BOM-KIT-0001

    @Column(nullable = false)
    private String bomName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BomType bomType;

    @ManyToOne
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal outputQty;

    @Column(nullable = false, length = 20)
    private String uom;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BomStatus status;

    private Integer version;

    private LocalDate effectiveDate;

    private LocalDate expiryDate;

    @Column(length = 1000)
    private String notes;

    @OneToMany(mappedBy = "bom", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private List<BomLine> lines = new ArrayList<>();

    private String createdBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void addLine(BomLine line) {
        line.setBom(this);
        lines.add(line);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = BomStatus.DRAFT;
        if (version == null)
            version = 1;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
