package com.factory.stockkeeper.dto;

import java.math.BigDecimal;

public record ProductionSummary(
        long totalOrders,
        long completedOrders,
        long inProgressOrders,
        long cancelledOrders,
        BigDecimal totalOutput,
        double avgLeadTimeDays,
        double completionRate) {
}
