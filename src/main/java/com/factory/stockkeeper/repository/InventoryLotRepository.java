package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.InventoryLot;
import com.factory.stockkeeper.model.MovementType;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface InventoryLotRepository extends JpaRepository<InventoryLot, Long> {

    String AVAILABLE_LOTS = "SELECT l FROM InventoryLot l WHERE l.product.id = :productId "
            + "AND l.warehouse.id = :warehouseId AND l.remain > 0 AND l.deleted = false "
            + "ORDER BY l.expiryDate ASC NULLS LAST, l.batchNo ASC, l.id ASC";

    /**
     * Locks every lot with a balance for the product/warehouse so concurrent issuance
     * against the same stock is serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query(AVAILABLE_LOTS)
    List<InventoryLot> findAvailableForUpdate(@Param("productId") Long productId,
            @Param("warehouseId") Long warehouseId);

    @Query(AVAILABLE_LOTS)
    List<InventoryLot> findAvailable(@Param("productId") Long productId, @Param("warehouseId") Long warehouseId);

    @Query("SELECT COALESCE(SUM(l.remain), 0) FROM InventoryLot l WHERE l.product.id = :productId "
            + "AND l.warehouse.id = :warehouseId AND l.remain > 0 AND l.deleted = false")
    BigDecimal sumRemain(@Param("productId") Long productId, @Param("warehouseId") Long warehouseId);

    @Query("SELECT COALESCE(SUM(l.remain), 0) FROM InventoryLot l WHERE l.product.id = :productId "
            + "AND l.remain > 0 AND l.deleted = false")
    BigDecimal sumRemainAllWarehouses(@Param("productId") Long productId);

    @Query("SELECT COALESCE(SUM(l.quantity), 0) FROM InventoryLot l WHERE l.product.id = :productId "
            + "AND l.warehouse.id = :warehouseId AND l.movementType IN :types AND l.deleted = false")
    BigDecimal sumQuantity(@Param("productId") Long productId, @Param("warehouseId") Long warehouseId,
            @Param("types") Collection<MovementType> types);

    @Query("SELECT l.product.id, l.warehouse.id, SUM(l.remain) FROM InventoryLot l "
            + "WHERE l.remain > 0 AND l.deleted = false GROUP BY l.product.id, l.warehouse.id")
    List<Object[]> sumRemainGrouped(); // [productId, warehouseId, balance]

    List<InventoryLot> findByProductIdAndWarehouseIdOrderByIdAsc(Long productId, Long warehouseId);

    List<InventoryLot> findByGroupIdOrderByIdAsc(String groupId);

    List<InventoryLot> findByBatchNoAndMovementTypeInOrderByIdAsc(String batchNo, Collection<MovementType> types);

    List<InventoryLot> findByMovementTypeInAndCreatedAtBetween(Collection<MovementType> types,
            LocalDateTime from, LocalDateTime to);

    @Query("SELECT l FROM InventoryLot l WHERE l.remain > 0 AND l.deleted = false "
            + "AND l.expiryDate IS NOT NULL AND l.expiryDate <= :limit ORDER BY l.expiryDate ASC, l.batchNo ASC")
    List<InventoryLot> findAvailableExpiringOnOrBefore(@Param("limit") LocalDate limit);
}
