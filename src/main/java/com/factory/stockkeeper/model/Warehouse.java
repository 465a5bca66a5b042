package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "warehouses")
@Data
@org.hibernate.annotations.SQLDelete(sql = "UPDATE warehouses SET deleted = true WHERE id = ?")
@org.hibernate.annotations.SQLRestriction("deleted = false")
public class Warehouse {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String code;

    @Column(nullable = false)
    private String name;

    // Legal entity owning the stock held here
    private Long companyId;

    private String companyName;

    private boolean active = true;

    private boolean deleted = false;
}
