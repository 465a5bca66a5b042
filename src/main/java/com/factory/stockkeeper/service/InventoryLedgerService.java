package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.InventoryLotRepository;
import com.factory.stockkeeper.repository.ProductRepository;
import com.factory.stockkeeper.repository.WarehouseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Append-only stock ledger. Lots are created by receipts (stock-in or production-in) and only
 * ever decremented by consumption, which also appends a PRODUCTION_OUT row pointing back at the
 * source lot. Balances are derived from lot {@code remain} values.
 */
@Service
@Slf4j
public class InventoryLedgerService {

    private static final EnumSet<MovementType> INBOUND = EnumSet.of(MovementType.STOCK_IN, MovementType.PRODUCTION_IN);
    private static final EnumSet<MovementType> OUTBOUND = EnumSet.of(MovementType.PRODUCTION_OUT);

    private final InventoryLotRepository lotRepository;
    private final ProductRepository productRepository;
    private final WarehouseRepository warehouseRepository;
    private final ReferenceDataService referenceDataService;
    private final SettingsService settingsService;
    private final AuditService auditService;

    public InventoryLedgerService(InventoryLotRepository lotRepository, ProductRepository productRepository,
            WarehouseRepository warehouseRepository, ReferenceDataService referenceDataService,
            SettingsService settingsService, AuditService auditService) {
        this.lotRepository = lotRepository;
        this.productRepository = productRepository;
        this.warehouseRepository = warehouseRepository;
        this.referenceDataService = referenceDataService;
        this.settingsService = settingsService;
        this.auditService = auditService;
    }

    /**
     * Books opening or purchased stock as a new lot.
     */
    @Transactional
    public InventoryLot receiveStock(StockReceiptRequest request, String actor) {
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new ValidationException("Received quantity must be greater than zero");
        }
        if (request.getBatchNo() == null || request.getBatchNo().isBlank()) {
            throw new ValidationException("Batch number is required");
        }
        InputLimits.checkQuantity("Received quantity", request.getQuantity());
        InputLimits.checkLength("Batch number", request.getBatchNo().trim(), InputLimits.CODE_LENGTH);
        InputLimits.checkLength("Source reference", request.getSourceRef(), InputLimits.CODE_LENGTH);
        Product product = referenceDataService.requireStockableProduct(request.getProductId());
        Warehouse warehouse = referenceDataService.requireWarehouse(request.getWarehouseId());

        InventoryLot lot = newInboundLot(MovementType.STOCK_IN, product, warehouse, request.getQuantity(),
                request.getBatchNo().trim(), request.getExpiryDate(), request.getSourceRef(),
                UUID.randomUUID().toString(), actor);
        lot = lotRepository.save(lot);

        auditService.log(actor, "STOCK_IN", request.getBatchNo(),
                "Product: " + product.getCode() + ", Warehouse: " + warehouse.getCode() + ", Qty: "
                        + request.getQuantity().toPlainString());
        log.info("Received {} {} of {} into {} as batch {}", request.getQuantity().toPlainString(),
                product.getUom(), product.getCode(), warehouse.getCode(), lot.getBatchNo());
        return lot;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public InventoryLot recordProductionIn(Product product, Warehouse warehouse, BigDecimal quantity, String batchNo,
            LocalDate expiryDate, String sourceRef, String groupId, String actor) {
        if (quantity == null || quantity.signum() < 0) {
            throw new ValidationException("Produced quantity cannot be negative");
        }
        InventoryLot lot = newInboundLot(MovementType.PRODUCTION_IN, product, warehouse, quantity, batchNo,
                expiryDate, sourceRef, groupId, actor);
        return lotRepository.save(lot);
    }

    /**
     * Takes {@code qty} out of {@code lot} and appends the matching PRODUCTION_OUT row. The lot
     * must have been read under lock by the caller.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InventoryLot consume(InventoryLot lot, BigDecimal qty, AllocationContext context) {
        lot.consume(qty);
        lotRepository.save(lot);

        InventoryLot out = new InventoryLot();
        out.setMovementType(MovementType.PRODUCTION_OUT);
        out.setProduct(lot.getProduct());
        out.setWarehouse(lot.getWarehouse());
        out.setQuantity(qty);
        out.setRemain(BigDecimal.ZERO);
        out.setBatchNo(lot.getBatchNo());
        out.setExpiryDate(lot.getExpiryDate());
        out.setSourceLot(lot);
        out.setSourceRef(context.sourceRef());
        out.setGroupId(context.groupId());
        out.setCreatedBy(context.actor());
        return lotRepository.save(out);
    }

    public BigDecimal stockBalance(Long productId, Long warehouseId) {
        if (warehouseId == null) {
            return lotRepository.sumRemainAllWarehouses(productId);
        }
        return lotRepository.sumRemain(productId, warehouseId);
    }

    /**
     * Open lots in the order FEFO would consume them, each classified by expiry.
     */
    public List<LotBalanceRow> stockByBatch(Long productId, Long warehouseId) {
        LocalDate today = LocalDate.now();
        return lotRepository.findAvailable(productId, warehouseId).stream()
                .map(lot -> new LotBalanceRow(
                        lot.getId(),
                        lot.getBatchNo(),
                        lot.getMovementType(),
                        lot.getQuantity(),
                        lot.getRemain(),
                        lot.getExpiryDate(),
                        classify(lot.getExpiryDate(), today),
                        lot.getExpiryDate() != null ? ChronoUnit.DAYS.between(today, lot.getExpiryDate()) : null))
                .toList();
    }

    public List<LedgerEntryRow> ledgerEntries(Long productId, Long warehouseId) {
        return lotRepository.findByProductIdAndWarehouseIdOrderByIdAsc(productId, warehouseId).stream()
                .map(LedgerEntryRow::from)
                .toList();
    }

    public LedgerReconciliation reconcile(Long productId, Long warehouseId) {
        BigDecimal received = lotRepository.sumQuantity(productId, warehouseId, INBOUND);
        BigDecimal consumed = lotRepository.sumQuantity(productId, warehouseId, OUTBOUND);
        BigDecimal lotBalance = lotRepository.sumRemain(productId, warehouseId);
        return new LedgerReconciliation(productId, warehouseId, received, consumed, lotBalance);
    }

    public List<ExpiryReportRow> expiryReport(int daysAhead) {
        LocalDate today = LocalDate.now();
        return lotRepository.findAvailableExpiringOnOrBefore(today.plusDays(daysAhead)).stream()
                .map(lot -> new ExpiryReportRow(
                        lot.getProduct().getName(),
                        lot.getBatchNo(),
                        lot.getWarehouse().getName(),
                        lot.getRemain(),
                        lot.getExpiryDate(),
                        classify(lot.getExpiryDate(), today),
                        ChronoUnit.DAYS.between(today, lot.getExpiryDate())))
                .toList();
    }

    /**
     * Stockable products whose balance in an active warehouse is below {@code threshold}
     * (the configured default when null). Products with no stock at all are included.
     */
    public List<LowStockRow> lowStock(Integer threshold) {
        BigDecimal min = BigDecimal.valueOf(threshold != null ? threshold : settingsService.getLowStockThreshold());

        Map<String, BigDecimal> balances = new HashMap<>();
        for (Object[] row : lotRepository.sumRemainGrouped()) {
            balances.put(row[0] + ":" + row[1], (BigDecimal) row[2]);
        }

        List<LowStockRow> result = new ArrayList<>();
        for (Product product : productRepository.findByServiceFalseAndApprovedTrue()) {
            for (Warehouse warehouse : warehouseRepository.findByActiveTrueOrderByNameAsc()) {
                BigDecimal current = balances.getOrDefault(product.getId() + ":" + warehouse.getId(), BigDecimal.ZERO);
                if (current.compareTo(min) < 0) {
                    result.add(new LowStockRow(product.getId(), product.getName(), warehouse.getName(), current, min,
                            min.subtract(current)));
                }
            }
        }
        result.sort(Comparator.comparing(LowStockRow::shortage).reversed());
        return result;
    }

    /**
     * Produced, consumed and net quantity per product for production movements in the range.
     */
    public List<ProductionImpactRow> productionImpact(LocalDate from, LocalDate to) {
        List<InventoryLot> movements = lotRepository.findByMovementTypeInAndCreatedAtBetween(
                EnumSet.of(MovementType.PRODUCTION_IN, MovementType.PRODUCTION_OUT),
                from.atStartOfDay(), to.plusDays(1).atStartOfDay());

        Map<Product, List<InventoryLot>> byProduct = movements.stream()
                .collect(Collectors.groupingBy(InventoryLot::getProduct, LinkedHashMap::new, Collectors.toList()));

        return byProduct.entrySet().stream()
                .map(entry -> {
                    BigDecimal produced = sum(entry.getValue(), MovementType.PRODUCTION_IN);
                    BigDecimal consumed = sum(entry.getValue(), MovementType.PRODUCTION_OUT);
                    return new ProductionImpactRow(entry.getKey().getId(), entry.getKey().getName(), produced,
                            consumed, produced.subtract(consumed));
                })
                .filter(row -> row.netChange().signum() != 0)
                .sorted(Comparator.comparing((ProductionImpactRow row) -> row.netChange().abs()).reversed())
                .toList();
    }

    public ExpiryStatus classify(LocalDate expiryDate, LocalDate today) {
        return ExpiryStatus.classify(expiryDate, today, settingsService.getCriticalDays(),
                settingsService.getWarningDays());
    }

    private static BigDecimal sum(List<InventoryLot> lots, MovementType type) {
        return lots.stream()
                .filter(l -> l.getMovementType() == type)
                .map(InventoryLot::getQuantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static InventoryLot newInboundLot(MovementType type, Product product, Warehouse warehouse,
            BigDecimal quantity, String batchNo, LocalDate expiryDate, String sourceRef, String groupId, String actor) {
        InventoryLot lot = new InventoryLot();
        lot.setMovementType(type);
        lot.setProduct(product);
        lot.setWarehouse(warehouse);
        lot.setQuantity(quantity);
        lot.setRemain(quantity);
        lot.setBatchNo(batchNo);
        lot.setExpiryDate(expiryDate);
        lot.setSourceRef(sourceRef);
        lot.setGroupId(groupId);
        lot.setCreatedBy(actor);
        return lot;
    }
}
