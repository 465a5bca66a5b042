package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.MaterialIssue;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface MaterialIssueRepository extends JpaRepository<MaterialIssue, Long> {
    Optional<MaterialIssue> findByIssueNo(String issueNo);

    List<MaterialIssue> findByOrderIdOrderByIdAsc(Long orderId);

    List<MaterialIssue> findTop20ByOrderByCreatedAtDesc();
}
