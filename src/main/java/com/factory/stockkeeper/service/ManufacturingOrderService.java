package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.exception.InvalidStateTransitionException;
import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives a manufacturing order through CONFIRMED, IN_PROGRESS and COMPLETED (or CANCELLED).
 * Each command is one unit of work: the order row is locked first, the status transition is
 * checked, and every row the command writes commits or rolls back together.
 */
@Service
@Slf4j
public class ManufacturingOrderService {

    private final ManufacturingOrderRepository orderRepository;
    private final MaterialRequirementRepository requirementRepository;
    private final MaterialIssueRepository issueRepository;
    private final ProductionReceiptRepository receiptRepository;
    private final BomHeaderRepository bomRepository;
    private final InventoryLotRepository lotRepository;
    private final BomExplosionCalculator explosionCalculator;
    private final FefoAllocationEngine allocationEngine;
    private final InventoryLedgerService ledgerService;
    private final GenealogyService genealogyService;
    private final ReferenceDataService referenceDataService;
    private final DocumentNumberService documentNumberService;
    private final AuditService auditService;
    private final UnitOfWork unitOfWork;

    public ManufacturingOrderService(ManufacturingOrderRepository orderRepository,
            MaterialRequirementRepository requirementRepository, MaterialIssueRepository issueRepository,
            ProductionReceiptRepository receiptRepository, BomHeaderRepository bomRepository,
            InventoryLotRepository lotRepository, BomExplosionCalculator explosionCalculator,
            FefoAllocationEngine allocationEngine, InventoryLedgerService ledgerService,
            GenealogyService genealogyService, ReferenceDataService referenceDataService,
            DocumentNumberService documentNumberService, AuditService auditService, UnitOfWork unitOfWork) {
        this.orderRepository = orderRepository;
        this.requirementRepository = requirementRepository;
        this.issueRepository = issueRepository;
        this.receiptRepository = receiptRepository;
        this.bomRepository = bomRepository;
        this.lotRepository = lotRepository;
        this.explosionCalculator = explosionCalculator;
        this.allocationEngine = allocationEngine;
        this.ledgerService = ledgerService;
        this.genealogyService = genealogyService;
        this.referenceDataService = referenceDataService;
        this.documentNumberService = documentNumberService;
        this.auditService = auditService;
        this.unitOfWork = unitOfWork;
    }

    /**
     * Creates the order in CONFIRMED together with its exploded material requirements.
     */
    public OrderView createOrder(CreateOrderRequest request, String actor) {
        if (request.getBomId() == null) {
            throw new ValidationException("BOM is required");
        }
        if (request.getPlannedQty() == null || request.getPlannedQty().signum() <= 0) {
            throw new ValidationException("Planned quantity must be greater than zero");
        }
        InputLimits.checkQuantity("Planned quantity", request.getPlannedQty());
        InputLimits.checkLength("Notes", request.getNotes(), InputLimits.NOTES_LENGTH);
        if (request.getScheduledDate() == null) {
            throw new ValidationException("Scheduled date is required");
        }

        return unitOfWork.execute("createOrder", () -> {
            BomHeader bom = bomRepository.findById(request.getBomId())
                    .orElseThrow(() -> NotFoundException.of("BOM", request.getBomId()));
            List<MaterialRequirementLine> lines = explosionCalculator.explode(bom, request.getPlannedQty(), true);
            Warehouse source = referenceDataService.requireWarehouse(request.getSourceWarehouseId());
            Warehouse target = referenceDataService.requireWarehouse(request.getTargetWarehouseId());

            ManufacturingOrder order = new ManufacturingOrder();
            order.setOrderNo(documentNumberService.next(DocumentNumberService.ORDER));
            order.setBom(bom);
            order.setProduct(bom.getProduct());
            order.setPlannedQty(request.getPlannedQty());
            order.setUom(bom.getUom());
            order.setSourceWarehouse(source);
            order.setTargetWarehouse(target);
            order.setEntityId(source.getCompanyId());
            order.setStatus(OrderStatus.CONFIRMED);
            order.setPriority(request.getPriority() != null ? request.getPriority() : OrderPriority.NORMAL);
            order.setScheduledDate(request.getScheduledDate());
            order.setNotes(request.getNotes());
            order.setCreatedBy(actor);

            for (MaterialRequirementLine line : lines) {
                InputLimits.checkQuantity("Required quantity", line.requiredQty());
                MaterialRequirement requirement = new MaterialRequirement();
                requirement.setMaterial(referenceDataService.requireProduct(line.materialId()));
                requirement.setRequiredQty(line.requiredQty());
                requirement.setUom(line.uom());
                requirement.setMaterialType(line.materialType());
                requirement.setWarehouse(source);
                order.addMaterial(requirement);
            }

            order = orderRepository.save(order);
            auditService.log(actor, "CREATE_ORDER", order.getOrderNo(),
                    "BOM: " + bom.getBomCode() + ", Qty: " + order.getPlannedQty().toPlainString()
                            + ", Materials: " + lines.size());
            log.info("Created manufacturing order {} for {} x {}", order.getOrderNo(),
                    order.getPlannedQty().toPlainString(), bom.getProduct().getCode());
            return OrderView.from(order);
        });
    }

    /**
     * Issues every outstanding requirement of the order from its source warehouse. Either all
     * requirements are satisfied by FEFO allocation or nothing is written.
     */
    public IssueResult issueMaterials(Long orderId, String actor) {
        return unitOfWork.execute("issueMaterials", () -> {
            ManufacturingOrder order = lockOrder(orderId);
            requireTransition(order, OrderStatus.IN_PROGRESS);

            List<MaterialRequirement> pending = requirementRepository.findByOrderIdOrderByIdAsc(orderId).stream()
                    .filter(r -> r.getStatus() == RequirementStatus.PENDING)
                    .toList();
            if (pending.isEmpty()) {
                throw new InvalidStateTransitionException(
                        "Order " + order.getOrderNo() + " has no pending materials to issue");
            }

            String groupId = UUID.randomUUID().toString();
            String issueNo = documentNumberService.next(DocumentNumberService.ISSUE);
            AllocationContext context = new AllocationContext(groupId, issueNo, actor);

            MaterialIssue issue = new MaterialIssue();
            issue.setIssueNo(issueNo);
            issue.setOrder(order);
            issue.setWarehouse(order.getSourceWarehouse());
            issue.setGroupId(groupId);
            issue.setIssuedBy(actor);

            List<IssueResult.IssuedMaterial> issued = new ArrayList<>();
            for (MaterialRequirement requirement : pending) {
                BigDecimal qty = requirement.getOutstandingQty();
                Product material = requirement.getMaterial();

                // Services (labour, setup) have no stock to draw from
                if (!material.isService() && qty.signum() > 0) {
                    for (LotAllocation allocation : allocationEngine.allocate(material, requirement.getWarehouse(),
                            qty, context)) {
                        InventoryLot lot = lotRepository.findById(allocation.lotId())
                                .orElseThrow(() -> NotFoundException.of("Lot", allocation.lotId()));
                        MaterialIssueDetail detail = new MaterialIssueDetail();
                        detail.setOrder(order);
                        detail.setMaterial(material);
                        detail.setLot(lot);
                        detail.setBatchNo(lot.getBatchNo());
                        detail.setQuantity(allocation.qtyTaken());
                        detail.setUom(requirement.getUom());
                        issue.addDetail(detail);
                        genealogyService.recordEdge(order, lot, allocation.qtyTaken(), groupId);
                    }
                }

                requirement.recordIssued(qty);
                requirementRepository.save(requirement);
                issued.add(new IssueResult.IssuedMaterial(material.getName(), qty, requirement.getUom()));
            }

            issueRepository.save(issue);
            order.setStatus(OrderStatus.IN_PROGRESS);
            order.setUpdatedBy(actor);
            orderRepository.save(order);

            auditService.log(actor, "ISSUE_MATERIALS", order.getOrderNo(),
                    "Issue: " + issueNo + ", Materials: " + issued.size() + ", Lots: " + issue.getDetails().size());
            log.info("Issued {} materials for order {} as {}", issued.size(), order.getOrderNo(), issueNo);
            return new IssueResult(issueNo, groupId, issued);
        });
    }

    /**
     * Books the finished quantity into the target warehouse as a new lot. Kits take the earliest
     * expiry of the lots they consumed; other recipes use the expiry given in the request.
     */
    public CompletionResult completeOrder(Long orderId, CompleteOrderRequest request, String actor) {
        if (request.getProducedQty() == null || request.getProducedQty().signum() < 0) {
            throw new ValidationException("Produced quantity cannot be negative");
        }
        InputLimits.checkQuantity("Produced quantity", request.getProducedQty());
        InputLimits.checkLength("Batch number", request.getBatchNo() != null ? request.getBatchNo().trim() : null,
                InputLimits.CODE_LENGTH);
        InputLimits.checkLength("Notes", request.getNotes(), InputLimits.NOTES_LENGTH);

        return unitOfWork.execute("completeOrder", () -> {
            ManufacturingOrder order = lockOrder(orderId);
            if (order.getStatus() != OrderStatus.IN_PROGRESS) {
                throw InvalidStateTransitionException.of("order " + order.getOrderNo(), order.getStatus(),
                        OrderStatus.COMPLETED);
            }
            BigDecimal producedQty = request.getProducedQty();
            if (producedQty.compareTo(order.getPlannedQty()) > 0) {
                throw new ValidationException("Produced quantity " + producedQty.toPlainString()
                        + " exceeds planned " + order.getPlannedQty().toPlainString());
            }

            String batchNo = request.getBatchNo() != null && !request.getBatchNo().isBlank()
                    ? request.getBatchNo().trim()
                    : documentNumberService.next(DocumentNumberService.BATCH);
            LocalDate expiryDate = order.getBom().getBomType() == BomType.KITTING
                    ? genealogyService.inheritedExpiry(orderId).orElse(null)
                    : request.getExpiryDate();
            QualityStatus quality = request.getQualityStatus() != null ? request.getQualityStatus()
                    : QualityStatus.PENDING;

            String groupId = UUID.randomUUID().toString();
            String receiptNo = documentNumberService.next(DocumentNumberService.RECEIPT);

            InventoryLot lot = ledgerService.recordProductionIn(order.getProduct(), order.getTargetWarehouse(),
                    producedQty, batchNo, expiryDate, receiptNo, groupId, actor);
            genealogyService.linkProducedLot(orderId, lot);

            ProductionReceipt receipt = new ProductionReceipt();
            receipt.setReceiptNo(receiptNo);
            receipt.setOrder(order);
            receipt.setProduct(order.getProduct());
            receipt.setQuantity(producedQty);
            receipt.setUom(order.getUom());
            receipt.setBatchNo(batchNo);
            receipt.setExpiryDate(expiryDate);
            receipt.setWarehouse(order.getTargetWarehouse());
            receipt.setQualityStatus(quality);
            receipt.setLot(lot);
            receipt.setNotes(request.getNotes());
            receipt.setCreatedBy(actor);
            receiptRepository.save(receipt);

            order.setProducedQty(producedQty);
            order.setStatus(OrderStatus.COMPLETED);
            order.setCompletionDate(LocalDateTime.now());
            order.setUpdatedBy(actor);
            orderRepository.save(order);

            auditService.log(actor, "COMPLETE_ORDER", order.getOrderNo(),
                    "Receipt: " + receiptNo + ", Batch: " + batchNo + ", Qty: " + producedQty.toPlainString());
            log.info("Completed order {}: {} {} as batch {}", order.getOrderNo(), producedQty.toPlainString(),
                    order.getUom(), batchNo);
            return new CompletionResult(receiptNo, batchNo, producedQty, expiryDate);
        });
    }

    /**
     * Cancels a CONFIRMED or IN_PROGRESS order. Materials already issued stay consumed.
     */
    public void cancelOrder(Long orderId, String actor) {
        unitOfWork.run("cancelOrder", () -> {
            ManufacturingOrder order = lockOrder(orderId);
            requireTransition(order, OrderStatus.CANCELLED);

            if (order.getStatus() == OrderStatus.IN_PROGRESS) {
                log.warn("Cancelling order {} after issuance, consumed lots are not returned to stock",
                        order.getOrderNo());
            }
            OrderStatus from = order.getStatus();
            order.setStatus(OrderStatus.CANCELLED);
            order.setUpdatedBy(actor);
            orderRepository.save(order);

            auditService.log(actor, "CANCEL_ORDER", order.getOrderNo(), "From: " + from);
            log.info("Cancelled order {}", order.getOrderNo());
        });
    }

    @Transactional(readOnly = true)
    public List<OrderView> listOrders(OrderStatus status, BomType bomType, LocalDate from, LocalDate to) {
        return orderRepository.search(status, bomType, from, to).stream()
                .map(OrderView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public OrderView getOrder(Long orderId) {
        return OrderView.from(findOrder(orderId));
    }

    @Transactional(readOnly = true)
    public List<RequirementView> getRequirements(Long orderId) {
        findOrder(orderId);
        return requirementRepository.findByOrderIdOrderByIdAsc(orderId).stream()
                .map(RequirementView::from)
                .toList();
    }

    /**
     * What {@link #issueMaterials} would take from which lots right now, without taking it.
     */
    @Transactional(readOnly = true)
    public List<RequirementPreview> previewIssue(Long orderId) {
        findOrder(orderId);
        List<RequirementPreview> previews = new ArrayList<>();
        for (MaterialRequirement requirement : requirementRepository.findByOrderIdOrderByIdAsc(orderId)) {
            BigDecimal outstanding = requirement.getOutstandingQty();
            if (requirement.getStatus() != RequirementStatus.PENDING || outstanding.signum() <= 0
                    || requirement.getMaterial().isService()) {
                continue;
            }
            AllocationPlan plan = allocationEngine.preview(requirement.getMaterial().getId(),
                    requirement.getWarehouse().getId(), outstanding);
            previews.add(new RequirementPreview(requirement.getMaterial().getId(),
                    requirement.getMaterial().getName(), outstanding, requirement.getUom(), plan));
        }
        return previews;
    }

    private ManufacturingOrder findOrder(Long orderId) {
        return orderRepository.findById(orderId).orElseThrow(() -> NotFoundException.of("Order", orderId));
    }

    private ManufacturingOrder lockOrder(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId).orElseThrow(() -> NotFoundException.of("Order", orderId));
    }

    private static void requireTransition(ManufacturingOrder order, OrderStatus target) {
        if (!order.getStatus().canTransitionTo(target)) {
            throw InvalidStateTransitionException.of("order " + order.getOrderNo(), order.getStatus(), target);
        }
    }
}
