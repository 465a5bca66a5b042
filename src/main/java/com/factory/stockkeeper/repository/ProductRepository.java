package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {
    Optional<Product> findByCode(String code);

    List<Product> findByServiceFalseAndApprovedTrue();
}
