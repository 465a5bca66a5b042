package com.factory.stockkeeper.service;

import com.factory.stockkeeper.TestDataFactory;
import com.factory.stockkeeper.dto.CreateOrderRequest;
import com.factory.stockkeeper.dto.OrderView;
import com.factory.stockkeeper.exception.ConcurrencyConflictException;
import com.factory.stockkeeper.exception.InsufficientStockException;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.BomHeaderRepository;
import com.factory.stockkeeper.repository.InventoryLotRepository;
import com.factory.stockkeeper.repository.ProductRepository;
import com.factory.stockkeeper.repository.WarehouseRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ConcurrentIssuanceTest {

    @Autowired
    private ManufacturingOrderService orderService;

    @Autowired
    private InventoryLedgerService ledgerService;

    @Autowired
    private InventoryLotRepository lotRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private WarehouseRepository warehouseRepository;

    @Autowired
    private BomHeaderRepository bomRepository;

    @Test
    void concurrentIssuesNeverOverdrawALot() throws Exception {
        TestDataFactory data = new TestDataFactory(productRepository, warehouseRepository, bomRepository,
                ledgerService);
        Warehouse rawStore = data.warehouse("WH-RACE");
        Warehouse finished = data.warehouse("WH-RACE-FG");
        Product resin = data.product("RM-RESIN");
        InventoryLot lot = data.stock(resin, rawStore, "10", "RESIN", LocalDate.now().plusDays(30));
        BomHeader bom = data.activeBom(BomType.CUTTING, data.product("FG-TILE"), resin, "1", "0");

        List<OrderView> orders = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            orders.add(orderService.createOrder(CreateOrderRequest.builder()
                    .bomId(bom.getId())
                    .plannedQty(new BigDecimal("6"))
                    .sourceWarehouseId(rawStore.getId())
                    .targetWarehouseId(finished.getId())
                    .scheduledDate(LocalDate.now())
                    .build(), "planner"));
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (OrderView order : orders) {
            futures.add(executor.submit(() -> {
                start.await();
                return orderService.issueMaterials(order.id(), "storekeeper-" + order.id());
            }));
        }
        start.countDown();

        int successes = 0;
        for (Future<?> future : futures) {
            try {
                future.get(60, TimeUnit.SECONDS);
                successes++;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                assertTrue(cause instanceof InsufficientStockException || cause instanceof ConcurrencyConflictException,
                        "Unexpected failure: " + cause);
            }
        }
        executor.shutdown();

        assertTrue(successes <= 1, "Both issuances succeeded against a 10 unit lot");
        BigDecimal remain = lotRepository.findById(lot.getId()).orElseThrow().getRemain();
        assertTrue(remain.signum() >= 0);
        assertEquals(0, BigDecimal.TEN.subtract(new BigDecimal("6").multiply(BigDecimal.valueOf(successes)))
                .compareTo(remain));
        assertTrue(ledgerService.reconcile(resin.getId(), rawStore.getId()).isConsistent());
    }
}
