package com.factory.stockkeeper.controller;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.service.FefoAllocationEngine;
import com.factory.stockkeeper.service.InventoryLedgerService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.security.Principal;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/inventory")
public class InventoryController {

    private final InventoryLedgerService ledgerService;
    private final FefoAllocationEngine allocationEngine;

    public InventoryController(InventoryLedgerService ledgerService, FefoAllocationEngine allocationEngine) {
        this.ledgerService = ledgerService;
        this.allocationEngine = allocationEngine;
    }

    @PostMapping("/receipts")
    public ResponseEntity<LedgerEntryRow> receive(@Valid @RequestBody StockReceiptRequest request,
            Principal principal) {
        String actor = principal != null ? principal.getName() : "SYSTEM";
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(LedgerEntryRow.from(ledgerService.receiveStock(request, actor)));
    }

    @GetMapping("/balance")
    public StockBalanceView balance(@RequestParam Long productId, @RequestParam(required = false) Long warehouseId) {
        return new StockBalanceView(productId, warehouseId, ledgerService.stockBalance(productId, warehouseId));
    }

    @GetMapping("/batches")
    public List<LotBalanceRow> batches(@RequestParam Long productId, @RequestParam Long warehouseId) {
        return ledgerService.stockByBatch(productId, warehouseId);
    }

    @GetMapping("/ledger")
    public List<LedgerEntryRow> ledger(@RequestParam Long productId, @RequestParam Long warehouseId) {
        return ledgerService.ledgerEntries(productId, warehouseId);
    }

    @GetMapping("/reconciliation")
    public LedgerReconciliation reconciliation(@RequestParam Long productId, @RequestParam Long warehouseId) {
        return ledgerService.reconcile(productId, warehouseId);
    }

    @GetMapping("/fefo-preview")
    public AllocationPlan fefoPreview(@RequestParam Long productId, @RequestParam Long warehouseId,
            @RequestParam BigDecimal qty) {
        return allocationEngine.preview(productId, warehouseId, qty);
    }

    @GetMapping("/expiry")
    public List<ExpiryReportRow> expiry(@RequestParam(defaultValue = "30") int days) {
        return ledgerService.expiryReport(days);
    }

    @GetMapping("/low-stock")
    public List<LowStockRow> lowStock(@RequestParam(required = false) Integer threshold) {
        return ledgerService.lowStock(threshold);
    }

    @GetMapping("/production-impact")
    public List<ProductionImpactRow> productionImpact(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ledgerService.productionImpact(from, to);
    }
}
