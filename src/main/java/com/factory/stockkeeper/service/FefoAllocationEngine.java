package com.factory.stockkeeper.service;

import com.factory.stockkeeper.dto.AllocationContext;
import com.factory.stockkeeper.dto.AllocationPlan;
import com.factory.stockkeeper.dto.LotAllocation;
import com.factory.stockkeeper.exception.InsufficientStockException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.ExpiryStatus;
import com.factory.stockkeeper.model.InventoryLot;
import com.factory.stockkeeper.model.Product;
import com.factory.stockkeeper.model.Warehouse;
import com.factory.stockkeeper.repository.InventoryLotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * First-Expired-First-Out lot selection over the inventory ledger.
 * <p>
 * Lots for the material/warehouse are read under a write lock, ordered by expiry (lots without
 * expiry last), then batch number, and walked until the requested quantity is covered. The
 * whole plan is computed before the first lot is touched, so a request that cannot be fully
 * covered fails with {@link InsufficientStockException} and leaves every lot unchanged.
 */
@Service
@Slf4j
public class FefoAllocationEngine {

    public static final Comparator<InventoryLot> FEFO_ORDER = Comparator
            .comparing(InventoryLot::getExpiryDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(InventoryLot::getBatchNo, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(InventoryLot::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final InventoryLotRepository lotRepository;
    private final InventoryLedgerService ledgerService;
    private final SettingsService settingsService;

    public FefoAllocationEngine(InventoryLotRepository lotRepository, InventoryLedgerService ledgerService,
            SettingsService settingsService) {
        this.lotRepository = lotRepository;
        this.ledgerService = ledgerService;
        this.settingsService = settingsService;
    }

    /**
     * Consumes {@code qty} of {@code material} from {@code warehouse}, one PRODUCTION_OUT row per
     * lot touched. Joins the caller's transaction when there is one.
     */
    @Transactional
    public List<LotAllocation> allocate(Product material, Warehouse warehouse, BigDecimal qty,
            AllocationContext context) {
        requirePositive(qty);

        List<InventoryLot> lots = eligible(lotRepository.findAvailableForUpdate(material.getId(), warehouse.getId()));
        AllocationPlan plan = plan(qty, lots, this::classify);

        if (!plan.isSatisfied()) {
            log.warn("FEFO allocation of {} {} from {} rejected, only {} available", qty.toPlainString(),
                    material.getCode(), warehouse.getCode(), plan.available().toPlainString());
            throw new InsufficientStockException(material.getCode(), material.getId(), warehouse.getId(), qty,
                    plan.available());
        }

        for (LotAllocation allocation : plan.allocations()) {
            InventoryLot lot = lots.stream()
                    .filter(l -> l.getId().equals(allocation.lotId()))
                    .findFirst()
                    .orElseThrow();
            ledgerService.consume(lot, allocation.qtyTaken(), context);
        }
        lotRepository.flush();

        log.debug("Allocated {} {} from {} lots in {}", qty.toPlainString(), material.getCode(),
                plan.allocations().size(), warehouse.getCode());
        return plan.allocations();
    }

    /**
     * Dry run of {@link #allocate}: same lot order and quantities, no lock and no writes.
     */
    @Transactional(readOnly = true)
    public AllocationPlan preview(Long materialId, Long warehouseId, BigDecimal qty) {
        requirePositive(qty);
        return plan(qty, eligible(lotRepository.findAvailable(materialId, warehouseId)), this::classify);
    }

    /**
     * Walks {@code lots} in FEFO order taking {@code min(outstanding, remain)} from each until
     * {@code requested} is covered. Pure; the lots are not modified.
     */
    public static AllocationPlan plan(BigDecimal requested, List<InventoryLot> lots,
            Function<LocalDate, ExpiryStatus> classifier) {
        List<InventoryLot> ordered = new ArrayList<>(lots);
        ordered.sort(FEFO_ORDER);

        BigDecimal available = BigDecimal.ZERO;
        BigDecimal outstanding = requested;
        List<LotAllocation> allocations = new ArrayList<>();
        for (InventoryLot lot : ordered) {
            if (lot.getRemain() == null || lot.getRemain().signum() <= 0) {
                continue;
            }
            available = available.add(lot.getRemain());
            if (outstanding.signum() <= 0) {
                continue;
            }
            BigDecimal take = outstanding.min(lot.getRemain());
            allocations.add(new LotAllocation(lot.getId(), lot.getBatchNo(), lot.getExpiryDate(),
                    classifier.apply(lot.getExpiryDate()), take));
            outstanding = outstanding.subtract(take);
        }
        return new AllocationPlan(requested, allocations, requested.subtract(outstanding.max(BigDecimal.ZERO)),
                available);
    }

    private List<InventoryLot> eligible(List<InventoryLot> lots) {
        if (settingsService.isAllowExpired()) {
            return lots;
        }
        LocalDate today = LocalDate.now();
        return lots.stream()
                .filter(l -> l.getExpiryDate() == null || !l.getExpiryDate().isBefore(today))
                .toList();
    }

    private ExpiryStatus classify(LocalDate expiryDate) {
        return ledgerService.classify(expiryDate, LocalDate.now());
    }

    private static void requirePositive(BigDecimal qty) {
        if (qty == null || qty.signum() <= 0) {
            throw new ValidationException("Quantity to allocate must be greater than zero");
        }
    }
}
