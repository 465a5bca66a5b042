package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.BatchGenealogyRepository;
import com.factory.stockkeeper.repository.BomLineRepository;
import com.factory.stockkeeper.repository.InventoryLotRepository;
import com.factory.stockkeeper.repository.ManufacturingOrderRepository;
import com.factory.stockkeeper.repository.ProductionReceiptRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;

/**
 * Traceability between consumed lots and the batches they went into, plus the expiry a kit
 * inherits from its components.
 */
@Service
public class GenealogyService {

    private static final EnumSet<MovementType> INBOUND = EnumSet.of(MovementType.STOCK_IN, MovementType.PRODUCTION_IN);

    private final BatchGenealogyRepository genealogyRepository;
    private final InventoryLotRepository lotRepository;
    private final ProductionReceiptRepository receiptRepository;
    private final BomLineRepository bomLineRepository;
    private final ManufacturingOrderRepository orderRepository;

    public GenealogyService(BatchGenealogyRepository genealogyRepository, InventoryLotRepository lotRepository,
            ProductionReceiptRepository receiptRepository, BomLineRepository bomLineRepository,
            ManufacturingOrderRepository orderRepository) {
        this.genealogyRepository = genealogyRepository;
        this.lotRepository = lotRepository;
        this.receiptRepository = receiptRepository;
        this.bomLineRepository = bomLineRepository;
        this.orderRepository = orderRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public BatchGenealogy recordEdge(ManufacturingOrder order, InventoryLot consumedLot, BigDecimal qty,
            String groupId) {
        BatchGenealogy edge = new BatchGenealogy();
        edge.setOutputOrder(order);
        edge.setConsumedLot(consumedLot);
        edge.setQuantity(qty);
        edge.setGroupId(groupId);
        return genealogyRepository.save(edge);
    }

    /**
     * Earliest expiry among the lots consumed by the order, ignoring lots without one.
     * Empty when no consumed lot carries an expiry.
     */
    public Optional<LocalDate> inheritedExpiry(Long orderId) {
        return genealogyRepository.findByOutputOrderIdOrderByIdAsc(orderId).stream()
                .map(edge -> edge.getConsumedLot().getExpiryDate())
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void linkProducedLot(Long orderId, InventoryLot producedLot) {
        for (BatchGenealogy edge : genealogyRepository.findByOutputOrderIdOrderByIdAsc(orderId)) {
            edge.setProducedLot(producedLot);
            genealogyRepository.save(edge);
        }
    }

    // Backward: which material lots went into this batch
    @Transactional(readOnly = true)
    public List<BatchSourceRow> sourcesOf(String batchNo) {
        List<BatchSourceRow> rows = new ArrayList<>();
        for (ProductionReceipt receipt : receiptRepository.findByBatchNoOrderByIdAsc(batchNo)) {
            for (BatchGenealogy edge : genealogyRepository.findByOutputOrderIdOrderByIdAsc(receipt.getOrder().getId())) {
                InventoryLot source = edge.getConsumedLot();
                rows.add(new BatchSourceRow(source.getProduct().getName(), edge.getQuantity(), source.getBatchNo(),
                        source.getExpiryDate()));
            }
        }
        return rows;
    }

    // Forward: which orders and output batches consumed this batch
    @Transactional(readOnly = true)
    public List<BatchUsageRow> usedIn(String sourceBatchNo) {
        return genealogyRepository.findByConsumedLotBatchNoOrderByIdAsc(sourceBatchNo).stream()
                .map(edge -> new BatchUsageRow(
                        edge.getConsumedLot().getBatchNo(),
                        edge.getOutputOrder().getOrderNo(),
                        edge.getOutputOrder().getProduct().getName(),
                        edge.getProducedLot() != null ? edge.getProducedLot().getBatchNo() : null,
                        edge.getQuantity()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<BatchLocationRow> locationsOf(String batchNo) {
        LocalDate today = LocalDate.now();
        return lotRepository.findByBatchNoAndMovementTypeInOrderByIdAsc(batchNo, INBOUND).stream()
                .filter(lot -> !lot.isDeleted())
                .map(lot -> new BatchLocationRow(
                        lot.getWarehouse().getName(),
                        lot.getRemain(),
                        locationStatus(lot, today),
                        lot.getUpdatedAt() != null ? lot.getUpdatedAt() : lot.getCreatedAt()))
                .toList();
    }

    /**
     * Header of a batch: the production receipt when it was manufactured here, otherwise the
     * stock-in lot it was received as.
     */
    @Transactional(readOnly = true)
    public BatchInfo batchInfo(String batchNo) {
        List<ProductionReceipt> receipts = receiptRepository.findByBatchNoOrderByIdAsc(batchNo);
        if (!receipts.isEmpty()) {
            ProductionReceipt receipt = receipts.get(0);
            return new BatchInfo(receipt.getBatchNo(), receipt.getProduct().getId(), receipt.getProduct().getCode(),
                    receipt.getProduct().getName(), receipt.getQuantity(), receipt.getUom(), receipt.getExpiryDate(),
                    receipt.getCreatedAt(), receipt.getWarehouse().getName());
        }
        return lotRepository.findByBatchNoAndMovementTypeInOrderByIdAsc(batchNo, INBOUND).stream()
                .findFirst()
                .map(lot -> new BatchInfo(lot.getBatchNo(), lot.getProduct().getId(), lot.getProduct().getCode(),
                        lot.getProduct().getName(), lot.getQuantity(), lot.getProduct().getUom(),
                        lot.getExpiryDate(), lot.getCreatedAt(), lot.getWarehouse().getName()))
                .orElseThrow(() -> NotFoundException.of("Batch", batchNo));
    }

    /**
     * BOMs that list the product as a material. Reads recipes, not genealogy.
     */
    @Transactional(readOnly = true)
    public List<WhereUsedRow> whereUsed(Long productId) {
        return bomLineRepository.findUsagesOfMaterial(productId).stream()
                .map(line -> new WhereUsedRow(
                        line.getBom().getId(),
                        line.getBom().getBomCode(),
                        line.getBom().getBomName(),
                        line.getBom().getStatus(),
                        line.getBom().getProduct().getName(),
                        line.getQuantity(),
                        line.getUom(),
                        line.getMaterialType()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ProducedBatchRow> batchesProduced(LocalDate from, LocalDate to) {
        return receiptRepository
                .findByReceiptDateBetweenOrderByReceiptDateDesc(from.atStartOfDay(), to.plusDays(1).atStartOfDay())
                .stream()
                .map(GenealogyService::toProducedBatch)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ProducedBatchRow> orderBatches(String orderNo) {
        ManufacturingOrder order = orderRepository.findByOrderNo(orderNo)
                .orElseThrow(() -> NotFoundException.of("Order", orderNo));
        return receiptRepository.findByOrderId(order.getId()).stream()
                .map(GenealogyService::toProducedBatch)
                .toList();
    }

    private static ProducedBatchRow toProducedBatch(ProductionReceipt receipt) {
        return new ProducedBatchRow(receipt.getBatchNo(), receipt.getReceiptDate(), receipt.getProduct().getName(),
                receipt.getQuantity(), receipt.getExpiryDate(), receipt.getQualityStatus(),
                receipt.getOrder().getOrderNo(), receipt.getOrder().getBom().getBomType());
    }

    static String locationStatus(InventoryLot lot, LocalDate today) {
        if (lot.getRemain().signum() <= 0) {
            return "CONSUMED";
        }
        if (lot.getExpiryDate() != null && lot.getExpiryDate().isBefore(today)) {
            return "EXPIRED";
        }
        return "AVAILABLE";
    }
}
