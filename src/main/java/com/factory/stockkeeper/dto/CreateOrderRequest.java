package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.OrderPriority;
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
public class CreateOrderRequest {
    @NotNull
    private Long bomId;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @Digits(integer = 14, fraction = 4)
    private BigDecimal plannedQty;

    @NotNull
    private Long sourceWarehouseId;

    @NotNull
    private Long targetWarehouseId;

    @NotNull
    private LocalDate scheduledDate;

    private OrderPriority priority;

    @Size(max = 1000)
    private String notes;
}
