package com.golden.controlplane.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.golden.controlplane.model.AuditEvent;
import com.golden.controlplane.repository.AuditEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Audit trail writer. Inside a caller transaction the row is written after that transaction commits,
 * in its own transaction, so a failed audit insert can never roll back the audited operation.
 */
@Service
@Slf4j
public class AuditEventService {

    static final int ACTOR_LENGTH = 128;
    static final int DESCRIPTION_LENGTH = 512;
    static final int METADATA_LENGTH = 4000;
    static final int CORRELATION_ID_LENGTH = 100;

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate auditTransaction;
    private final Clock clock;

    public AuditEventService(AuditEventRepository auditEventRepository,
                             ObjectMapper objectMapper,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.auditEventRepository = auditEventRepository;
        this.objectMapper = objectMapper;
        this.auditTransaction = new TransactionTemplate(transactionManager);
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public void recordEvent(String actor, String eventType, String action, String description, Object metadata) {
        AuditEvent event;
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            event = AuditEvent.builder()
                    .actor(truncate(actor, ACTOR_LENGTH))
                    .eventType(eventType)
                    .action(action)
                    .description(truncate(description, DESCRIPTION_LENGTH))
                    .metadata(truncate(payload, METADATA_LENGTH))
                    .correlationId(truncate(MDC.get("correlationId"), CORRELATION_ID_LENGTH))
                    .createdAt(Instant.now(clock))
                    .build();
        } catch (Exception e) {
            log.warn("Failed to build audit event {}:{} - {}", eventType, action, e.getMessage());
            return;
        }

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    save(event);
                }
            });
        } else {
            save(event);
        }
    }

    private void save(AuditEvent event) {
        try {
            auditTransaction.executeWithoutResult(status -> auditEventRepository.save(event));
        } catch (Exception e) {
            log.warn("Failed to record audit event {}:{} - {}", event.getEventType(), event.getAction(), e.getMessage());
        }
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
