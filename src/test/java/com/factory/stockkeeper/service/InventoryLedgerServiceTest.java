package com.factory.stockkeeper.service;

import com.factory.stockkeeper.TestDataFactory;
import com.factory.stockkeeper.dto.*;
import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.BomHeaderRepository;
import com.factory.stockkeeper.repository.ProductRepository;
import com.factory.stockkeeper.repository.WarehouseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class InventoryLedgerServiceTest {

    @Autowired
    private InventoryLedgerService ledgerService;

    @Autowired
    private FefoAllocationEngine allocationEngine;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private WarehouseRepository warehouseRepository;

    @Autowired
    private BomHeaderRepository bomRepository;

    private TestDataFactory data;
    private Product material;
    private Warehouse warehouse;

    @BeforeEach
    void setUp() {
        data = new TestDataFactory(productRepository, warehouseRepository, bomRepository, ledgerService);
        material = data.product("RM-FLOUR");
        warehouse = data.warehouse("WH-MAIN");
    }

    @Test
    void receiveStock_createsOpenLot() {
        InventoryLot lot = data.stock(material, warehouse, "25.5", "GRN1", LocalDate.now().plusDays(90));

        assertEquals(MovementType.STOCK_IN, lot.getMovementType());
        assertEquals(0, lot.getQuantity().compareTo(lot.getRemain()));
        assertNotNull(lot.getGroupId());
        assertEquals(0, new BigDecimal("25.5").compareTo(ledgerService.stockBalance(material.getId(), warehouse.getId())));
    }

    @Test
    void receiveStock_rejectsServiceProducts() {
        Product labour = data.service("SV-LABOUR");

        assertThrows(ValidationException.class,
                () -> data.stock(labour, warehouse, "1", "GRN2", null));
    }

    @Test
    void receiveStock_rejectsUnknownWarehouse() {
        StockReceiptRequest request = StockReceiptRequest.builder()
                .productId(material.getId())
                .warehouseId(-1L)
                .quantity(BigDecimal.TEN)
                .batchNo("X")
                .build();

        assertThrows(NotFoundException.class, () -> ledgerService.receiveStock(request, "tester"));
    }

    @Test
    void receiveStock_rejectsValuesThatDoNotFitTheLedger() {
        StockReceiptRequest longBatch = StockReceiptRequest.builder()
                .productId(material.getId())
                .warehouseId(warehouse.getId())
                .quantity(BigDecimal.TEN)
                .batchNo("G".repeat(300))
                .build();
        StockReceiptRequest hugeQty = StockReceiptRequest.builder()
                .productId(material.getId())
                .warehouseId(warehouse.getId())
                .quantity(new BigDecimal("123456789012345"))
                .batchNo(data.code("GRN-BIG"))
                .build();

        assertThrows(ValidationException.class, () -> ledgerService.receiveStock(longBatch, "tester"));
        assertThrows(ValidationException.class, () -> ledgerService.receiveStock(hugeQty, "tester"));
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.stockBalance(material.getId(), warehouse.getId())));
    }

    @Test
    void balance_equalsReceiptsMinusConsumptionAndOpenLots() {
        data.stock(material, warehouse, "40", "L1", LocalDate.now().plusDays(10));
        data.stock(material, warehouse, "60", "L2", LocalDate.now().plusDays(40));
        allocationEngine.allocate(material, warehouse, new BigDecimal("55"),
                new AllocationContext(UUID.randomUUID().toString(), "MI-TEST", "tester"));

        LedgerReconciliation reconciliation = ledgerService.reconcile(material.getId(), warehouse.getId());

        assertEquals(0, new BigDecimal("100").compareTo(reconciliation.received()));
        assertEquals(0, new BigDecimal("55").compareTo(reconciliation.consumed()));
        assertTrue(reconciliation.isConsistent());
        assertEquals(0, new BigDecimal("45").compareTo(ledgerService.stockBalance(material.getId(), warehouse.getId())));
        assertEquals(0, new BigDecimal("45").compareTo(ledgerService.stockBalance(material.getId(), null)));
    }

    @Test
    void stockByBatch_classifiesExpiryInFefoOrder() {
        data.stock(material, warehouse, "1", "OK", LocalDate.now().plusDays(100));
        data.stock(material, warehouse, "1", "WARN", LocalDate.now().plusDays(20));
        data.stock(material, warehouse, "1", "CRIT", LocalDate.now().plusDays(3));
        data.stock(material, warehouse, "1", "EXP", LocalDate.now().minusDays(1));
        data.stock(material, warehouse, "1", "NONE", null);

        List<LotBalanceRow> rows = ledgerService.stockByBatch(material.getId(), warehouse.getId());

        assertEquals(List.of(ExpiryStatus.EXPIRED, ExpiryStatus.CRITICAL, ExpiryStatus.WARNING, ExpiryStatus.OK,
                ExpiryStatus.OK), rows.stream().map(LotBalanceRow::expiryStatus).toList());
        assertEquals(data.code("NONE"), rows.get(4).batchNo());
        assertNull(rows.get(4).daysToExpiry());
        assertEquals(3L, rows.get(1).daysToExpiry());
    }

    @Test
    void expiryReport_onlyListsLotsInsideWindow() {
        data.stock(material, warehouse, "3", "SOON", LocalDate.now().plusDays(5));
        data.stock(material, warehouse, "3", "LATER", LocalDate.now().plusDays(200));

        List<String> batches = ledgerService.expiryReport(10).stream().map(ExpiryReportRow::batchNo).toList();

        assertTrue(batches.contains(data.code("SOON")));
        assertFalse(batches.contains(data.code("LATER")));
    }

    @Test
    void lowStock_flagsProductsUnderThreshold() {
        data.stock(material, warehouse, "12", "LOW", null);

        LowStockRow row = ledgerService.lowStock(20).stream()
                .filter(r -> r.productId().equals(material.getId()) && r.warehouse().equals(warehouse.getName()))
                .findFirst()
                .orElseThrow();

        assertEquals(0, new BigDecimal("12").compareTo(row.currentStock()));
        assertEquals(0, new BigDecimal("8").compareTo(row.shortage()));
        assertTrue(ledgerService.lowStock(10).stream()
                .noneMatch(r -> r.productId().equals(material.getId()) && r.warehouse().equals(warehouse.getName())));
    }
}
