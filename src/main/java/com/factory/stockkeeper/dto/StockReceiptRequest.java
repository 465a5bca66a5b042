package com.factory.stockkeeper.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
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
public class StockReceiptRequest {
    @NotNull
    private Long productId;

    @NotNull
    private Long warehouseId;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @Digits(integer = 14, fraction = 4)
    private BigDecimal quantity;

    @NotBlank
    @Size(max = 100)
    private String batchNo;

    private LocalDate expiryDate;

    @Size(max = 100)
    private String sourceRef; // e.g. supplier GRN number
}
