package com.golden.controlplane.service.dlq;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.dto.ResolveResult;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.exception.NotFoundException;
import com.golden.controlplane.exception.RetriesExhaustedException;
import com.golden.controlplane.exception.ValidationException;
import com.golden.controlplane.model.DeadLetterMessage;
import com.golden.controlplane.model.WorkItem;
import com.golden.controlplane.repository.DeadLetterMessageRepository;
import com.golden.controlplane.repository.WorkItemRepository;
import com.golden.controlplane.service.AlertService;
import com.golden.controlplane.service.AuditEventService;
import com.golden.controlplane.service.ControlPlaneMetrics;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dead-letter store: parked work items awaiting a human decision.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterService {

    private static final int MAX_PAGE_SIZE = 500;

    private final DeadLetterMessageRepository repository;
    private final WorkItemRepository workItemRepository;
    private final AlertService alertService;
    private final AuditEventService auditEventService;
    private final ControlPlaneMetrics metrics;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    @PostConstruct
    void registerGauge() {
        metrics.registerGauge("dlq_unresolved", repository::countByResolvedFalse);
    }

    /**
     * Parks a message whose delivery already failed its full retry budget elsewhere.
     */
    @Transactional
    public Long enqueue(String destination, String payload, String error) {
        int maxAttempts = properties.getDeadLetter().getMaxAttempts();
        return enqueue(destination, payload, error, maxAttempts, maxAttempts);
    }

    @Transactional
    public Long enqueue(String destination, String payload, String error, int attemptCount, int maxAttempts) {
        if (destination == null || destination.isBlank()) {
            throw new ValidationException("destination is required");
        }
        if (payload == null) {
            throw new ValidationException("payload is required");
        }
        return store(destination, payload, error, attemptCount, maxAttempts, null).getId();
    }

    /**
     * Moves an exhausted work item into the store. Runs inside the caller's transaction.
     */
    @Transactional
    public DeadLetterMessage park(WorkItem item) {
        return store(item.getDestination(), item.getPayload(), item.getLastError(),
                item.getAttempts(), item.getMaxAttempts(), item.getId());
    }

    /**
     * Marks a message resolved. With {@code requeue} the original payload is republished to its
     * original destination as a fresh work item and the attempt count starts over.
     */
    @Transactional
    public ResolveResult resolve(Long messageId, String note, boolean requeue, String actor) {
        DeadLetterMessage message = repository.findForUpdate(messageId)
                .orElseThrow(() -> new NotFoundException("Dead letter message not found: " + messageId));
        if (message.isResolved()) {
            throw new ConflictException("Dead letter message " + messageId + " is already resolved");
        }

        Instant now = Instant.now(clock);
        Long workItemId = null;
        if (requeue) {
            workItemId = workItemRepository.save(WorkItem.pending(message.getOriginalDestination(), message.getPayload(),
                    message.getMaxAttempts(), now)).getId();
            message.setAttemptCount(0);
            message.setRequeued(true);
        }
        message.setResolved(true);
        message.setResolutionNote(note);
        message.setResolvedBy(actor);
        message.setResolvedAt(now);
        repository.save(message);

        metrics.recordDeadLetterResolved();
        log.info("✅ DLQ message {} resolved by {} (requeue={})", messageId, actor, requeue);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("messageId", messageId);
        metadata.put("destination", message.getOriginalDestination());
        metadata.put("requeue", requeue);
        metadata.put("workItemId", workItemId);
        auditEventService.recordEvent(actor, "DEAD_LETTER", requeue ? "REQUEUED" : "DROPPED",
                note == null ? "Dead letter resolved" : note, metadata);
        return new ResolveResult(ResolveResult.RESOLVED, messageId, requeue, workItemId);
    }

    @Transactional(readOnly = true)
    public DeadLetterMessage get(Long messageId) {
        return repository.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Dead letter message not found: " + messageId));
    }

    /**
     * Newest first.
     *
     * @param resolved filter on resolution state, or null for all messages
     */
    @Transactional(readOnly = true)
    public List<DeadLetterMessage> list(Boolean resolved, int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new ValidationException("offset must be >= 0");
        }
        PageRequest window = PageRequest.of(0, offset + limit);
        List<DeadLetterMessage> rows = resolved == null
                ? repository.findAllByOrderByCreatedAtDescIdDesc(window)
                : repository.findByResolvedOrderByCreatedAtDescIdDesc(resolved, window);
        if (offset >= rows.size()) {
            return List.of();
        }
        return List.copyOf(rows.subList(offset, rows.size()));
    }

    @Transactional(readOnly = true)
    public long unresolvedCount() {
        return repository.countByResolvedFalse();
    }

    private DeadLetterMessage store(String destination, String payload, String error,
                                    int attemptCount, int maxAttempts, Long sourceWorkItemId) {
        DeadLetterMessage message = repository.save(DeadLetterMessage.builder()
                .originalDestination(destination)
                .payload(payload)
                .lastError(error)
                .attemptCount(attemptCount)
                .maxAttempts(maxAttempts)
                .sourceWorkItemId(sourceWorkItemId)
                .resolved(false)
                .requeued(false)
                .createdAt(Instant.now(clock))
                .build());

        log.error("💀 DLQ Entry: [{}] message={} attempts={} -> {}", destination, message.getId(), attemptCount, error);
        metrics.recordDeadLetterParked();
        alertService.sendAlert("RETRIES_EXHAUSTED",
                "Work for " + destination + " parked in dead-letter store as message " + message.getId(),
                new RetriesExhaustedException(destination, attemptCount, error),
                Map.of("messageId", message.getId(), "destination", destination));
        return message;
    }
}
