package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.IssueStatus;
import com.factory.stockkeeper.model.MaterialIssueDetail;
import org.springframework.data.jpa.repository.JpaRepository;
import java.time.LocalDateTime;
import java.util.List;

public interface MaterialIssueDetailRepository extends JpaRepository<MaterialIssueDetail, Long> {
    List<MaterialIssueDetail> findByOrderIdOrderByIdAsc(Long orderId);

    List<MaterialIssueDetail> findByIssueStatusAndIssueIssueDateBetween(IssueStatus status,
            LocalDateTime from, LocalDateTime to);
}
