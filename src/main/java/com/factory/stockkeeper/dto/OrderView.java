package com.factory.stockkeeper.dto;

import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.model.ManufacturingOrder;
import com.factory.stockkeeper.model.OrderPriority;
import com.factory.stockkeeper.model.OrderStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record OrderView(
        Long id,
        String orderNo,
        LocalDate orderDate,
        LocalDate scheduledDate,
        LocalDateTime completionDate,
        OrderStatus status,
        OrderPriority priority,
        BigDecimal plannedQty,
        BigDecimal producedQty,
        String uom,
        Long entityId,
        String productCode,
        String productName,
        String bomCode,
        BomType bomType,
        String sourceWarehouse,
        String targetWarehouse,
        String notes) {

    public static OrderView from(ManufacturingOrder order) {
        return new OrderView(
                order.getId(),
                order.getOrderNo(),
                order.getOrderDate(),
                order.getScheduledDate(),
                order.getCompletionDate(),
                order.getStatus(),
                order.getPriority(),
                order.getPlannedQty(),
                order.getProducedQty(),
                order.getUom(),
                order.getEntityId(),
                order.getProduct().getCode(),
                order.getProduct().getName(),
                order.getBom().getBomCode(),
                order.getBom().getBomType(),
                order.getSourceWarehouse().getName(),
                order.getTargetWarehouse().getName(),
                order.getNotes());
    }
}
