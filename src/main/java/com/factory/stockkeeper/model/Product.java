package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "products")
@Data
@org.hibernate.annotations.SQLDelete(sql = "UPDATE products SET deleted = true WHERE id = ?")
@org.hibernate.annotations.SQLRestriction("deleted = false")
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String code; // e.g. RM-SUGAR-01

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 20)
    private String uom;

    // Services (labour, setup) are never stocked
    private boolean service = false;

    private boolean approved = true;

    private boolean deleted = false;
}
