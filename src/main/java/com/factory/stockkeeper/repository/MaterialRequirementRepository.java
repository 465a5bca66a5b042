package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.MaterialRequirement;
import com.factory.stockkeeper.model.RequirementStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface MaterialRequirementRepository extends JpaRepository<MaterialRequirement, Long> {
    List<MaterialRequirement> findByOrderIdOrderByIdAsc(Long orderId);

    long countByOrderIdAndStatus(Long orderId, RequirementStatus status);
}
