package com.factory.stockkeeper.controller;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.model.OrderStatus;
import com.factory.stockkeeper.service.ManufacturingOrderService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/orders")
public class ManufacturingOrderController {

    private final ManufacturingOrderService orderService;

    public ManufacturingOrderController(ManufacturingOrderService orderService) {
        this.orderService = orderService;
    }

    @PostMapping
    public ResponseEntity<OrderView> create(@Valid @RequestBody CreateOrderRequest request, Principal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orderService.createOrder(request, actor(principal)));
    }

    @GetMapping
    public List<OrderView> list(@RequestParam(required = false) OrderStatus status,
            @RequestParam(required = false) BomType type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return orderService.listOrders(status, type, from, to);
    }

    @GetMapping("/{id}")
    public OrderView get(@PathVariable Long id) {
        return orderService.getOrder(id);
    }

    @GetMapping("/{id}/materials")
    public List<RequirementView> materials(@PathVariable Long id) {
        return orderService.getRequirements(id);
    }

    @GetMapping("/{id}/issue-preview")
    public List<RequirementPreview> issuePreview(@PathVariable Long id) {
        return orderService.previewIssue(id);
    }

    @PostMapping("/{id}/issue")
    public IssueResult issue(@PathVariable Long id, Principal principal) {
        return orderService.issueMaterials(id, actor(principal));
    }

    @PostMapping("/{id}/complete")
    public CompletionResult complete(@PathVariable Long id, @Valid @RequestBody CompleteOrderRequest request,
            Principal principal) {
        return orderService.completeOrder(id, request, actor(principal));
    }

    @PostMapping("/{id}/cancel")
    public OrderView cancel(@PathVariable Long id, Principal principal) {
        orderService.cancelOrder(id, actor(principal));
        return orderService.getOrder(id);
    }

    private static String actor(Principal principal) {
        return principal != null ? principal.getName() : "SYSTEM";
    }
}
