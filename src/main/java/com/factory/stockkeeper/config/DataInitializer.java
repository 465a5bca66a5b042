package com.factory.stockkeeper.config;

import com.factory.stockkeeper.dto.BomRequest;
import com.factory.stockkeeper.dto.BomView;
import com.factory.stockkeeper.dto.StockReceiptRequest;
import com.factory.stockkeeper.model.*;
import com.factory.stockkeeper.repository.ProductRepository;
import com.factory.stockkeeper.repository.WarehouseRepository;
import com.factory.stockkeeper.service.BomService;
import com.factory.stockkeeper.service.InventoryLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Seeds a small factory (two warehouses, a gift-box kit and its components with stock) so the
 * API can be tried out. Off unless {@code manufacturing.demo-data.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "manufacturing.demo-data.enabled", havingValue = "true")
@Slf4j
public class DataInitializer {

    private static final String ACTOR = "SYSTEM";

    @Bean
    CommandLineRunner init(ProductRepository productRepo, WarehouseRepository warehouseRepo,
            BomService bomService, InventoryLedgerService ledgerService) {
        return args -> {
            if (productRepo.count() > 0) {
                return;
            }

            Warehouse rawStore = warehouse(warehouseRepo, "WH-RM", "Raw Material Store");
            Warehouse finished = warehouse(warehouseRepo, "WH-FG", "Finished Goods Store");

            Product kit = product(productRepo, "FG-GIFTBOX", "Gift Box Assorted", "BOX", false);
            Product cookies = product(productRepo, "RM-COOKIE", "Butter Cookies 200g", "PCS", false);
            Product jam = product(productRepo, "RM-JAM", "Strawberry Jam 100g", "PCS", false);
            Product box = product(productRepo, "PK-BOX", "Printed Gift Box", "PCS", false);
            Product labour = product(productRepo, "SV-ASSEMBLY", "Assembly Labour", "HR", true);

            BomRequest request = BomRequest.builder()
                    .bomName("Gift Box Assorted")
                    .bomType(BomType.KITTING)
                    .productId(kit.getId())
                    .outputQty(BigDecimal.ONE)
                    .uom("BOX")
                    .effectiveDate(LocalDate.now())
                    .lines(List.of(
                            line(cookies, MaterialType.RAW_MATERIAL, "2", "PCS", "0"),
                            line(jam, MaterialType.RAW_MATERIAL, "1", "PCS", "0"),
                            line(box, MaterialType.PACKAGING, "1", "PCS", "2"),
                            line(labour, MaterialType.CONSUMABLE, "0.1", "HR", "0")))
                    .build();
            BomView bom = bomService.createBom(request, ACTOR);
            bomService.updateStatus(bom.id(), BomStatus.ACTIVE, ACTOR);

            receive(ledgerService, cookies, rawStore, "500", "CK-2401", LocalDate.now().plusDays(20));
            receive(ledgerService, cookies, rawStore, "500", "CK-2402", LocalDate.now().plusDays(90));
            receive(ledgerService, jam, rawStore, "300", "JM-2401", LocalDate.now().plusDays(5));
            receive(ledgerService, jam, rawStore, "300", "JM-2402", LocalDate.now().plusDays(180));
            receive(ledgerService, box, rawStore, "400", "BX-2401", null);

            log.info("Demo data loaded: BOM {} with stock in {} (finished goods go to {})", bom.bomCode(),
                    rawStore.getCode(), finished.getCode());
        };
    }

    private static Warehouse warehouse(WarehouseRepository repo, String code, String name) {
        Warehouse warehouse = new Warehouse();
        warehouse.setCode(code);
        warehouse.setName(name);
        warehouse.setCompanyId(1L);
        warehouse.setCompanyName("Demo Foods Ltd");
        return repo.save(warehouse);
    }

    private static Product product(ProductRepository repo, String code, String name, String uom, boolean service) {
        Product product = new Product();
        product.setCode(code);
        product.setName(name);
        product.setUom(uom);
        product.setService(service);
        return repo.save(product);
    }

    private static BomRequest.Line line(Product material, MaterialType type, String qty, String uom, String scrap) {
        return BomRequest.Line.builder()
                .materialId(material.getId())
                .materialType(type)
                .quantity(new BigDecimal(qty))
                .uom(uom)
                .scrapRate(new BigDecimal(scrap))
                .build();
    }

    private static void receive(InventoryLedgerService ledgerService, Product product, Warehouse warehouse,
            String qty, String batchNo, LocalDate expiry) {
        ledgerService.receiveStock(StockReceiptRequest.builder()
                .productId(product.getId())
                .warehouseId(warehouse.getId())
                .quantity(new BigDecimal(qty))
                .batchNo(batchNo)
                .expiryDate(expiry)
                .sourceRef("OPENING")
                .build(), ACTOR);
    }
}
