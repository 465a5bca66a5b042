package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.ManufacturingOrderRepository;
import com.factory.stockkeeper.repository.MaterialIssueDetailRepository;
import com.factory.stockkeeper.repository.MaterialIssueRepository;
import com.factory.stockkeeper.repository.ProductionReceiptRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Date-ranged production and consumption aggregates. Advisory only: reads are not isolated
 * from commands running at the same time.
 */
@Service
@Transactional(readOnly = true)
public class ProductionReportService {

    private final ManufacturingOrderRepository orderRepository;
    private final ProductionReceiptRepository receiptRepository;
    private final MaterialIssueRepository issueRepository;
    private final MaterialIssueDetailRepository issueDetailRepository;

    public ProductionReportService(ManufacturingOrderRepository orderRepository,
            ProductionReceiptRepository receiptRepository, MaterialIssueRepository issueRepository,
            MaterialIssueDetailRepository issueDetailRepository) {
        this.orderRepository = orderRepository;
        this.receiptRepository = receiptRepository;
        this.issueRepository = issueRepository;
        this.issueDetailRepository = issueDetailRepository;
    }

    public ProductionSummary summary(LocalDate from, LocalDate to) {
        checkRange(from, to);
        List<ManufacturingOrder> orders = orderRepository.findByOrderDateBetween(from, to);
        Map<OrderStatus, Long> counts = countByStatus(orders);
        List<ManufacturingOrder> completed = orders.stream()
                .filter(o -> o.getStatus() == OrderStatus.COMPLETED)
                .toList();

        BigDecimal totalOutput = completed.stream()
                .map(ManufacturingOrder::getProducedQty)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        double avgLeadTime = completed.stream()
                .filter(o -> o.getCreatedAt() != null && o.getCompletionDate() != null)
                .mapToDouble(o -> Duration.between(o.getCreatedAt(), o.getCompletionDate()).toMinutes() / 1440.0)
                .average()
                .orElse(0);
        double completionRate = orders.isEmpty() ? 0 : completed.size() * 100.0 / orders.size();

        return new ProductionSummary(orders.size(), counts.get(OrderStatus.COMPLETED),
                counts.get(OrderStatus.IN_PROGRESS), counts.get(OrderStatus.CANCELLED), totalOutput,
                round(avgLeadTime), round(completionRate));
    }

    // Output per day and product
    public List<DailyQuantityRow> dailyProduction(LocalDate from, LocalDate to) {
        checkRange(from, to);
        Map<LocalDate, Map<String, BigDecimal>> grouped = new TreeMap<>();
        for (ProductionReceipt receipt : receipts(from, to)) {
            grouped.computeIfAbsent(receipt.getReceiptDate().toLocalDate(), d -> new TreeMap<>())
                    .merge(receipt.getProduct().getName(), receipt.getQuantity(), BigDecimal::add);
        }
        return flatten(grouped);
    }

    public Map<BomType, BigDecimal> productionByType(LocalDate from, LocalDate to) {
        checkRange(from, to);
        Map<BomType, BigDecimal> totals = new EnumMap<>(BomType.class);
        for (ProductionReceipt receipt : receipts(from, to)) {
            totals.merge(receipt.getOrder().getBom().getBomType(), receipt.getQuantity(), BigDecimal::add);
        }
        return totals;
    }

    /**
     * Issued quantity per material, optionally for one source warehouse, largest first.
     */
    public List<MaterialConsumptionRow> materialConsumption(LocalDate from, LocalDate to, Long warehouseId) {
        checkRange(from, to);
        long days = ChronoUnit.DAYS.between(from, to) + 1;

        Map<Product, List<MaterialIssueDetail>> byMaterial = issuedDetails(from, to).stream()
                .filter(d -> warehouseId == null || d.getIssue().getWarehouse().getId().equals(warehouseId))
                .collect(Collectors.groupingBy(MaterialIssueDetail::getMaterial, LinkedHashMap::new,
                        Collectors.toList()));

        return byMaterial.entrySet().stream()
                .map(entry -> {
                    BigDecimal total = entry.getValue().stream()
                            .map(MaterialIssueDetail::getQuantity)
                            .reduce(BigDecimal.ZERO, BigDecimal::add);
                    long orderCount = entry.getValue().stream()
                            .map(d -> d.getOrder().getId())
                            .distinct()
                            .count();
                    return new MaterialConsumptionRow(entry.getKey().getName(), total, entry.getKey().getUom(),
                            orderCount, total.divide(BigDecimal.valueOf(days), 4, RoundingMode.HALF_UP));
                })
                .sorted(Comparator.comparing(MaterialConsumptionRow::totalConsumed).reversed())
                .toList();
    }

    public List<DailyQuantityRow> dailyMaterialConsumption(LocalDate from, LocalDate to) {
        checkRange(from, to);
        Map<LocalDate, Map<String, BigDecimal>> grouped = new TreeMap<>();
        for (MaterialIssueDetail detail : issuedDetails(from, to)) {
            grouped.computeIfAbsent(detail.getIssue().getIssueDate().toLocalDate(), d -> new TreeMap<>())
                    .merge(detail.getMaterial().getName(), detail.getQuantity(), BigDecimal::add);
        }
        return flatten(grouped);
    }

    public Map<OrderStatus, Long> statusDistribution(LocalDate from, LocalDate to) {
        checkRange(from, to);
        return countByStatus(orderRepository.findByOrderDateBetween(from, to));
    }

    /**
     * Produced versus planned quantity of completed orders, per recipe type.
     */
    public List<EfficiencyRow> efficiencyByType(LocalDate from, LocalDate to) {
        checkRange(from, to);
        Map<BomType, List<ManufacturingOrder>> byType = orderRepository.findByOrderDateBetween(from, to).stream()
                .filter(o -> o.getStatus() == OrderStatus.COMPLETED)
                .collect(Collectors.groupingBy(o -> o.getBom().getBomType(), () -> new EnumMap<>(BomType.class),
                        Collectors.toList()));

        List<EfficiencyRow> rows = new ArrayList<>();
        byType.forEach((type, orders) -> {
            BigDecimal planned = orders.stream().map(ManufacturingOrder::getPlannedQty)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal produced = orders.stream().map(ManufacturingOrder::getProducedQty)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            double pct = planned.signum() == 0 ? 0
                    : produced.multiply(BigDecimal.valueOf(100)).divide(planned, 2, RoundingMode.HALF_UP)
                            .doubleValue();
            rows.add(new EfficiencyRow(type, orders.size(), planned, produced, pct));
        });
        return rows;
    }

    /**
     * Latest order, issue and receipt events, newest first.
     */
    public List<ActivityRow> recentActivities(int limit) {
        List<ActivityRow> rows = new ArrayList<>();
        orderRepository.findTop20ByOrderByCreatedAtDesc().forEach(o -> rows.add(
                new ActivityRow("ORDER_CREATED", o.getOrderNo(), o.getCreatedAt(), o.getCreatedBy())));
        issueRepository.findTop20ByOrderByCreatedAtDesc().forEach(i -> rows.add(
                new ActivityRow("MATERIAL_ISSUED", i.getIssueNo(), i.getCreatedAt(), i.getIssuedBy())));
        receiptRepository.findTop20ByOrderByCreatedAtDesc().forEach(r -> rows.add(
                new ActivityRow("PRODUCTION_RECEIPT", r.getReceiptNo(), r.getCreatedAt(), r.getCreatedBy())));

        return rows.stream()
                .sorted(Comparator.comparing(ActivityRow::timestamp,
                        Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())).reversed())
                .limit(Math.max(limit, 0))
                .toList();
    }

    private List<ProductionReceipt> receipts(LocalDate from, LocalDate to) {
        return receiptRepository.findByReceiptDateBetweenOrderByReceiptDateDesc(from.atStartOfDay(),
                to.plusDays(1).atStartOfDay());
    }

    private List<MaterialIssueDetail> issuedDetails(LocalDate from, LocalDate to) {
        return issueDetailRepository.findByIssueStatusAndIssueIssueDateBetween(IssueStatus.CONFIRMED,
                from.atStartOfDay(), to.plusDays(1).atStartOfDay());
    }

    private static Map<OrderStatus, Long> countByStatus(List<ManufacturingOrder> orders) {
        Map<OrderStatus, Long> counts = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            counts.put(status, 0L);
        }
        orders.forEach(o -> counts.merge(o.getStatus(), 1L, Long::sum));
        return counts;
    }

    private static List<DailyQuantityRow> flatten(Map<LocalDate, Map<String, BigDecimal>> grouped) {
        List<DailyQuantityRow> rows = new ArrayList<>();
        grouped.forEach((date, perCategory) -> perCategory
                .forEach((category, qty) -> rows.add(new DailyQuantityRow(date, category, qty))));
        return rows;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static void checkRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Both start and end dates are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("Start date " + from + " is after end date " + to);
        }
    }
}
