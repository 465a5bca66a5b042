package com.factory.stockkeeper.controller;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.model.OrderStatus;
import com.factory.stockkeeper.service.ProductionReportService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final ProductionReportService reportService;

    public ReportController(ProductionReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/summary")
    public ProductionSummary summary(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.summary(from, to);
    }

    @GetMapping("/daily-production")
    public List<DailyQuantityRow> dailyProduction(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.dailyProduction(from, to);
    }

    @GetMapping("/production-by-type")
    public Map<BomType, BigDecimal> productionByType(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.productionByType(from, to);
    }

    @GetMapping("/consumption")
    public List<MaterialConsumptionRow> consumption(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) Long warehouseId) {
        return reportService.materialConsumption(from, to, warehouseId);
    }

    @GetMapping("/daily-consumption")
    public List<DailyQuantityRow> dailyConsumption(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.dailyMaterialConsumption(from, to);
    }

    @GetMapping("/status")
    public Map<OrderStatus, Long> status(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.statusDistribution(from, to);
    }

    @GetMapping("/efficiency")
    public List<EfficiencyRow> efficiency(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportService.efficiencyByType(from, to);
    }

    @GetMapping("/activities")
    public List<ActivityRow> activities(@RequestParam(defaultValue = "10") int limit) {
        return reportService.recentActivities(limit);
    }
}
