package com.factory.stockkeeper.repository;

import com.factory.stockkeeper.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByReferenceOrderByTimestampAsc(String reference);
}
