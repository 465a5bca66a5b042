package com.factory.stockkeeper.controller;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.service.GenealogyService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/batches")
public class TraceabilityController {

    private final GenealogyService genealogyService;

    public TraceabilityController(GenealogyService genealogyService) {
        this.genealogyService = genealogyService;
    }

    @GetMapping("/produced")
    public List<ProducedBatchRow> produced(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return genealogyService.batchesProduced(from, to);
    }

    @GetMapping("/by-order/{orderNo}")
    public List<ProducedBatchRow> byOrder(@PathVariable String orderNo) {
        return genealogyService.orderBatches(orderNo);
    }

    @GetMapping("/{batchNo}")
    public BatchInfo info(@PathVariable String batchNo) {
        return genealogyService.batchInfo(batchNo);
    }

    @GetMapping("/{batchNo}/sources")
    public List<BatchSourceRow> sources(@PathVariable String batchNo) {
        return genealogyService.sourcesOf(batchNo);
    }

    @GetMapping("/{batchNo}/locations")
    public List<BatchLocationRow> locations(@PathVariable String batchNo) {
        return genealogyService.locationsOf(batchNo);
    }

    @GetMapping("/{batchNo}/used-in")
    public List<BatchUsageRow> usedIn(@PathVariable String batchNo) {
        return genealogyService.usedIn(batchNo);
    }
}
