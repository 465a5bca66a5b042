package com.factory.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * Runtime override of a {@code manufacturing.*} property, keyed by the property name.
 */
@Entity
@Table(name = "app_settings")
@Data
@NoArgsConstructor
public class AppSetting {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String settingKey; // e.g. manufacturing.allocation.max-retries

    @Column(nullable = false)
    private String settingValue;

    private String updatedBy;

    private LocalDateTime updatedAt;

    public AppSetting(String key, String value, String updatedBy) {
        this.settingKey = key;
        this.settingValue = value;
        this.updatedBy = updatedBy;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
