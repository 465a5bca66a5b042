package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.BatchGenealogy;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface BatchGenealogyRepository extends JpaRepository<BatchGenealogy, Long> {
    List<BatchGenealogy> findByOutputOrderIdOrderByIdAsc(Long orderId);

    List<BatchGenealogy> findByConsumedLotBatchNoOrderByIdAsc(String batchNo);
}
