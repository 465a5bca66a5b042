package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.QualityStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteOrderRequest {
    @NotNull
    @DecimalMin("0")
    @Digits(integer = 14, fraction = 4)
    private BigDecimal producedQty;

    // Generated when blank
    @Size(max = 100)
    private String batchNo;

    private QualityStatus qualityStatus;

    // Only honoured for CUTTING / REPACKING; kits inherit the earliest component expiry
    private LocalDate expiryDate;

    @Size(max = 1000)
    private String notes;
}
