package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.ActivityRow;
import com.factory.stockkeeper.dto.EfficiencyRow;
import com.factory.stockkeeper.dto.ProductionSummary;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.ManufacturingOrderRepository;
import com.factory.stockkeeper.repository.MaterialIssueDetailRepository;
import com.factory.stockkeeper.repository.MaterialIssueRepository;
import com.factory.stockkeeper.repository.ProductionReceiptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class ProductionReportServiceTest {

    @Mock
    private ManufacturingOrderRepository orderRepository;

    @Mock
    private ProductionReceiptRepository receiptRepository;

    @Mock
    private MaterialIssueRepository issueRepository;

    @Mock
    private MaterialIssueDetailRepository issueDetailRepository;

    @InjectMocks
    private ProductionReportService reportService;

    private final LocalDate from = LocalDate.of(2026, 3, 1);
    private final LocalDate to = LocalDate.of(2026, 3, 31);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void summary_countsStatusesAndLeadTime() {
        LocalDateTime created = LocalDateTime.of(2026, 3, 2, 8, 0);
        when(orderRepository.findByOrderDateBetween(from, to)).thenReturn(List.of(
                order(BomType.KITTING, OrderStatus.COMPLETED, "10", "10", created, created.plusDays(2)),
                order(BomType.KITTING, OrderStatus.COMPLETED, "10", "8", created, created.plusDays(1)),
                order(BomType.CUTTING, OrderStatus.IN_PROGRESS, "5", "0", created, null),
                order(BomType.CUTTING, OrderStatus.CANCELLED, "5", "0", created, null)));

        ProductionSummary summary = reportService.summary(from, to);

        assertEquals(4, summary.totalOrders());
        assertEquals(2, summary.completedOrders());
        assertEquals(1, summary.inProgressOrders());
        assertEquals(1, summary.cancelledOrders());
        assertEquals(0, new BigDecimal("18").compareTo(summary.totalOutput()));
        assertEquals(1.5, summary.avgLeadTimeDays());
        assertEquals(50.0, summary.completionRate());
    }

    @Test
    void efficiencyByType_comparesProducedWithPlanned() {
        LocalDateTime created = LocalDateTime.of(2026, 3, 2, 8, 0);
        when(orderRepository.findByOrderDateBetween(from, to)).thenReturn(List.of(
                order(BomType.KITTING, OrderStatus.COMPLETED, "10", "10", created, created.plusHours(5)),
                order(BomType.KITTING, OrderStatus.COMPLETED, "10", "8", created, created.plusHours(5)),
                order(BomType.CUTTING, OrderStatus.IN_PROGRESS, "5", "0", created, null)));

        List<EfficiencyRow> rows = reportService.efficiencyByType(from, to);

        assertEquals(1, rows.size());
        assertEquals(BomType.KITTING, rows.get(0).bomType());
        assertEquals(2, rows.get(0).completedOrders());
        assertEquals(90.0, rows.get(0).efficiencyPct());
    }

    @Test
    void statusDistribution_includesEmptyStatuses() {
        when(orderRepository.findByOrderDateBetween(from, to)).thenReturn(List.of(
                order(BomType.REPACKING, OrderStatus.CONFIRMED, "1", "0", LocalDateTime.now(), null)));

        Map<OrderStatus, Long> distribution = reportService.statusDistribution(from, to);

        assertEquals(1L, distribution.get(OrderStatus.CONFIRMED));
        assertEquals(0L, distribution.get(OrderStatus.COMPLETED));
    }

    @Test
    void recentActivities_mergesNewestFirst() {
        LocalDateTime now = LocalDateTime.of(2026, 3, 10, 12, 0);
        ManufacturingOrder order = order(BomType.KITTING, OrderStatus.CONFIRMED, "1", "0", now.minusHours(3), null);
        order.setOrderNo("MO-20260310-0001");
        MaterialIssue issue = new MaterialIssue();
        issue.setIssueNo("MI-20260310-0001");
        issue.setCreatedAt(now.minusHours(1));
        ProductionReceipt receipt = new ProductionReceipt();
        receipt.setReceiptNo("PR-20260310-0001");
        receipt.setCreatedAt(now);
        when(orderRepository.findTop20ByOrderByCreatedAtDesc()).thenReturn(List.of(order));
        when(issueRepository.findTop20ByOrderByCreatedAtDesc()).thenReturn(List.of(issue));
        when(receiptRepository.findTop20ByOrderByCreatedAtDesc()).thenReturn(List.of(receipt));

        List<ActivityRow> rows = reportService.recentActivities(2);

        assertEquals(2, rows.size());
        assertEquals("PR-20260310-0001", rows.get(0).reference());
        assertEquals("MATERIAL_ISSUED", rows.get(1).activity());
    }

    @Test
    void reports_rejectInvertedRange() {
        assertThrows(ValidationException.class, () -> reportService.summary(to, from));
        assertThrows(ValidationException.class, () -> reportService.materialConsumption(null, to, null));
    }

    private static ManufacturingOrder order(BomType type, OrderStatus status, String planned, String produced,
            LocalDateTime createdAt, LocalDateTime completedAt) {
        BomHeader bom = new BomHeader();
        bom.setBomType(type);
        ManufacturingOrder order = new ManufacturingOrder();
        order.setBom(bom);
        order.setStatus(status);
        order.setPlannedQty(new BigDecimal(planned));
        order.setProducedQty(new BigDecimal(produced));
        order.setCreatedAt(createdAt);
        order.setCompletionDate(completedAt);
        return order;
    }
}
