package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.BomType;
import com.factory.stockkeeper.model.ManufacturingOrder;
import com.factory.stockkeeper.model.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ManufacturingOrderRepository extends JpaRepository<ManufacturingOrder, Long> {
    Optional<ManufacturingOrder> findByOrderNo(String orderNo);

    List<ManufacturingOrder> findByStatus(OrderStatus status);

    List<ManufacturingOrder> findByOrderDateBetween(LocalDate from, LocalDate to);

    List<ManufacturingOrder> findTop20ByOrderByCreatedAtDesc();

    // Null filters match everything
    @Query("SELECT o FROM ManufacturingOrder o WHERE (:status IS NULL OR o.status = :status) "
            + "AND (:bomType IS NULL OR o.bom.bomType = :bomType) "
            + "AND (:fromDate IS NULL OR o.orderDate >= :fromDate) "
            + "AND (:toDate IS NULL OR o.orderDate <= :toDate) "
            + "ORDER BY o.orderDate DESC, o.id DESC")
    List<ManufacturingOrder> search(@Param("status") OrderStatus status, @Param("bomType") BomType bomType,
            @Param("fromDate") LocalDate from, @Param("toDate") LocalDate to);

    // Serializes lifecycle commands on the same order
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM ManufacturingOrder o WHERE o.id = :id")
    Optional<ManufacturingOrder> findByIdForUpdate(@Param("id") Long id);
}
