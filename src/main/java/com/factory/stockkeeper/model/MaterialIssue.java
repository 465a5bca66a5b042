package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "material_issues")
@Data
public class MaterialIssue {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String issueNo;

    @ManyToOne
    @JoinColumn(name = "order_id", nullable = false)
    private ManufacturingOrder order;

    @Column(nullable = false)
    private LocalDateTime issueDate;

    @ManyToOne
    @JoinColumn(name = "warehouse_id", nullable = false)
    private Warehouse warehouse;

    @Column(nullable = false)
    private String groupId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IssueStatus status;

    private String issuedBy;

    @OneToMany(mappedBy = "issue", cascade = CascadeType.ALL)
    @OrderBy("id ASC")
    @lombok.ToString.Exclude
    @lombok.EqualsAndHashCode.Exclude
    private List<MaterialIssueDetail> details = new ArrayList<>();

    @Column(updatable = false)
    private LocalDateTime createdAt;

    public void addDetail(MaterialIssueDetail detail) {
        detail.setIssue(this);
        details.add(detail);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (issueDate == null)
            issueDate = createdAt;
        if (status == null)
            status = IssueStatus.CONFIRMED;
    }
}
