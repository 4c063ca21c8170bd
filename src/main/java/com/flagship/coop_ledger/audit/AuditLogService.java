package com.flagship.coop_ledger.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.coop_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Fire-and-forget audit sink.
 *
 * Each record is written in its own transaction, and a failure to write it is
 * logged and dropped. An audit outage never fails or rolls back the business
 * operation being audited.
 */
@Service
@Slf4j
public class AuditLogService {

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;

    public AuditLogService(AuditLogRepository repository, ObjectMapper objectMapper,
                           PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void record(String tenantId, String actorId, AuditAction action,
                       String resourceType, UUID resourceId, Map<String, ?> details) {
        try {
            AuditLogEntity entry = new AuditLogEntity(
                UUID.randomUUID(),
                tenantId,
                actorId,
                action,
                resourceType,
                resourceId,
                details == null || details.isEmpty() ? null : objectMapper.writeValueAsString(details),
                CorrelationContext.getCorrelationId(),
                Instant.now()
            );
            requiresNew.executeWithoutResult(status -> repository.save(entry));
        } catch (Exception e) {
            log.warn("Failed to write audit log: action={}, resourceType={}, resourceId={}, error={}",
                action, resourceType, resourceId, e.getMessage());
        }
    }
}
