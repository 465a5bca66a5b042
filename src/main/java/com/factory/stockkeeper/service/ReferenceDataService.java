package com.factory.stockkeeper.service;

import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.exception.ValidationException;
import com.factory.stockkeeper.model.Product;
import com.factory.stockkeeper.model.Warehouse;
import com.factory.stockkeeper.repository.ProductRepository;
import com.factory.stockkeeper.repository.WarehouseRepository;
import org.springframework.stereotype.Service;

/**
 * Read-only lookups into product and warehouse master data.
 */
@Service
public class ReferenceDataService {

    private final ProductRepository productRepository;
    private final WarehouseRepository warehouseRepository;

    public ReferenceDataService(ProductRepository productRepository, WarehouseRepository warehouseRepository) {
        this.productRepository = productRepository;
        this.warehouseRepository = warehouseRepository;
    }

    public Product requireProduct(Long productId) {
        if (productId == null) {
            throw new ValidationException("Product is required");
        }
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> NotFoundException.of("Product", productId));
        if (!product.isApproved()) {
            throw new ValidationException("Product " + product.getCode() + " is not approved");
        }
        return product;
    }

    public Product requireStockableProduct(Long productId) {
        Product product = requireProduct(productId);
        if (product.isService()) {
            throw new ValidationException("Product " + product.getCode() + " is a service and cannot be stocked");
        }
        return product;
    }

    public Warehouse requireWarehouse(Long warehouseId) {
        if (warehouseId == null) {
            throw new ValidationException("Warehouse is required");
        }
        Warehouse warehouse = warehouseRepository.findById(warehouseId)
                .orElseThrow(() -> NotFoundException.of("Warehouse", warehouseId));
        if (!warehouse.isActive()) {
            throw new ValidationException("Warehouse " + warehouse.getCode() + " is not active");
        }
        return warehouse;
    }
}
