package com.factory.stockkeeper.service;

import com.factory.stockkeeper.model.AuditLog;
import com.factory.stockkeeper.repository.AuditLogRepository;
import org.springframework.stereotype.Service;

@Service
public class AuditService {

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    // Runs inside the caller's transaction so the trail rolls back with the command
    public void log(String actor, String action, String reference, String details) {
        AuditLog log = new AuditLog();
        log.setUsername(actor != null && !actor.isBlank() ? actor : "SYSTEM");
        log.setAction(action);
        log.setReference(reference);
        log.setDetails(details);
        auditLogRepository.save(log);
    }
}
