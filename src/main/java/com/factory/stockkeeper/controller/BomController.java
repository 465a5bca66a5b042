package com.factory.stockkeeper.controller;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.model.BomStatus;
import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.service.BomService;
import com.factory.stockkeeper.service.GenealogyService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/boms")
public class BomController {

    private final BomService bomService;
    private final GenealogyService genealogyService;

    public BomController(BomService bomService, GenealogyService genealogyService) {
        this.bomService = bomService;
        this.genealogyService = genealogyService;
    }

    @GetMapping
    public List<BomView> list(@RequestParam(required = false) BomType type,
            @RequestParam(required = false) BomStatus status,
            @RequestParam(required = false) String search) {
        return bomService.listBoms(type, status, search);
    }

    @GetMapping("/{id}")
    public BomView get(@PathVariable Long id) {
        return bomService.getBom(id);
    }

    @PostMapping
    public ResponseEntity<BomView> create(@Valid @RequestBody BomRequest request, Principal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bomService.createBom(request, actor(principal)));
    }

    @PutMapping("/{id}/status")
    public BomView updateStatus(@PathVariable Long id, @RequestParam BomStatus status, Principal principal) {
        return bomService.updateStatus(id, status, actor(principal));
    }

    @GetMapping("/{id}/explode")
    public List<MaterialRequirementLine> explode(@PathVariable Long id, @RequestParam BigDecimal qty) {
        return bomService.explode(id, qty);
    }

    @GetMapping("/{id}/availability")
    public List<AvailabilityRow> availability(@PathVariable Long id, @RequestParam BigDecimal qty,
            @RequestParam Long warehouseId) {
        return bomService.checkAvailability(id, qty, warehouseId);
    }

    @GetMapping("/where-used/{productId}")
    public List<WhereUsedRow> whereUsed(@PathVariable Long productId) {
        return genealogyService.whereUsed(productId);
    }

    @GetMapping("/material-usage")
    public List<MaterialUsageRow> materialUsage() {
        return bomService.materialUsageSummary();
    }

    private static String actor(Principal principal) {
        return principal != null ? principal.getName() : "SYSTEM";
    }
}
