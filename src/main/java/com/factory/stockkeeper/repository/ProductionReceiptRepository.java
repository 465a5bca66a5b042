package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.ProductionReceipt;
import org.springframework.data.jpa.repository.JpaRepository;
import java.time.LocalDateTime;
import java.util.List;

public interface ProductionReceiptRepository extends JpaRepository<ProductionReceipt, Long> {
    List<ProductionReceipt> findByBatchNoOrderByIdAsc(String batchNo);

    List<ProductionReceipt> findByOrderId(Long orderId);

    List<ProductionReceipt> findByReceiptDateBetweenOrderByReceiptDateDesc(LocalDateTime from, LocalDateTime to);

    List<ProductionReceipt> findTop20ByOrderByCreatedAtDesc();
}
