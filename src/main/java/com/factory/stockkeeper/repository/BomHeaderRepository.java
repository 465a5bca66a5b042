package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.BomHeader;
import com.factory.stockkeeper.model.BomStatus;
import com.factory.stockkeeper.model.BomType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.List;
import java.util.Optional;

public interface BomHeaderRepository extends JpaRepository<BomHeader, Long> {
    Optional<BomHeader> findByBomCode(String bomCode);

    List<BomHeader> findByStatus(BomStatus status);

    Optional<BomHeader> findTopByBomCodeStartingWithOrderByBomCodeDesc(String prefix);

    // pattern is a lower-case LIKE pattern, or null for no text filter
    @Query("SELECT b FROM BomHeader b WHERE (:bomType IS NULL OR b.bomType = :bomType) "
            + "AND (:status IS NULL OR b.status = :status) "
            + "AND (:pattern IS NULL OR LOWER(b.bomName) LIKE :pattern OR LOWER(b.bomCode) LIKE :pattern) "
            + "ORDER BY b.bomCode ASC")
    List<BomHeader> search(@Param("bomType") BomType bomType, @Param("status") BomStatus status,
            @Param("pattern") String pattern);
}
