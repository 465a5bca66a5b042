package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.BomLine;
import com.factory.stockkeeper.model.BomType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.List;

public interface BomLineRepository extends JpaRepository<BomLine, Long> {

    @Query("SELECT l FROM BomLine l WHERE l.material.id = :materialId ORDER BY l.bom.status, l.bom.bomName")
    List<BomLine> findUsagesOfMaterial(@Param("materialId") Long materialId);

    @Query("SELECT l.material.id, l.material.name, COUNT(DISTINCT l.bom.id), SUM(l.quantity) FROM BomLine l "
            + "WHERE l.bom.status = com.factory.stockkeeper.model.BomStatus.ACTIVE "
            + "GROUP BY l.material.id, l.material.name ORDER BY COUNT(DISTINCT l.bom.id) DESC, SUM(l.quantity) DESC")
    List<Object[]> summarizeActiveUsage(); // [materialId, materialName, bomCount, totalQty]

    @Query("SELECT DISTINCT l.bom.bomType FROM BomLine l WHERE l.material.id = :materialId "
            + "AND l.bom.status = com.factory.stockkeeper.model.BomStatus.ACTIVE")
    List<BomType> findActiveBomTypesUsing(@Param("materialId") Long materialId);
}
