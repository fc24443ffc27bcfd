package com.golden.controlplane.service.budget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.dto.BudgetDecision;
import com.golden.controlplane.dto.BudgetSnapshot;
import com.golden.controlplane.dto.CommitResult;
import com.golden.controlplane.dto.LedgerReconciliation;
import com.golden.controlplane.dto.ReleaseResult;
import com.golden.controlplane.dto.TokenRequest;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.exception.StorageException;
import com.golden.controlplane.exception.ValidationException;
import com.golden.controlplane.service.AuditEventService;
import com.golden.controlplane.service.ControlPlaneMetrics;
import com.golden.controlplane.service.idempotency.IdempotencyStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Exactly-once reserve/commit/release over {@link BudgetLedger}.
 * <p>
 * The idempotency store answers client retransmissions quickly and keeps two identical in-flight
 * requests from both reaching the ledger. The ledger stays authoritative: once a cached decision
 * expires, a replayed request id is answered from its reservation row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdempotentBudgetController {

    static final String IN_PROGRESS = "IN_PROGRESS";

    private final BudgetLedger ledger;
    private final IdempotencyStore idempotencyStore;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ControlPlaneProperties properties;
    private final ControlPlaneMetrics metrics;
    private final AuditEventService auditEventService;

    public BudgetDecision requestTokens(TokenRequest request) {
        validate(request);
        String key = cacheKey(request.tenantId(), request.requestId());

        Optional<BudgetDecision> cached = cachedDecision(key);
        if (cached.isPresent()) {
            log.debug("Budget request {} served from idempotency cache", request.requestId());
            metrics.recordBudgetRequest("cached");
            return cached.get();
        }

        ControlPlaneProperties.Budget config = properties.getBudget();
        if (!idempotencyStore.putIfAbsent(key, IN_PROGRESS, config.getInProgressTtl())) {
            metrics.recordBudgetRequest("duplicate");
            return awaitDuplicate(request, key);
        }

        BudgetDecision decision;
        try {
            decision = decide(request);
        } catch (RuntimeException e) {
            releaseMarker(key);
            throw e;
        }

        try {
            idempotencyStore.put(key, serialize(decision), config.getIdempotencyTtl());
        } catch (RuntimeException e) {
            log.warn("Failed to cache budget decision for request {}: {}", request.requestId(), e.getMessage());
            releaseMarker(key);
        }
        metrics.recordBudgetRequest(decision.approved() ? "approved" : "declined");
        if (!decision.approved()) {
            auditDecline(request, decision);
        }
        return decision;
    }

    public CommitResult commitUsage(String reservationId, long actualTokens) {
        requireReservationId(reservationId);
        if (actualTokens < 0) {
            throw new ValidationException("actualTokens must be >= 0", List.of("actualTokens: must be greater than or equal to 0"));
        }
        CommitResult result = storage(() -> ledger.commit(reservationId, actualTokens), "commit " + reservationId);
        if (result.status() == CommitResult.Status.COMMITTED) {
            metrics.recordBudgetCommit();
        }
        return result;
    }

    public ReleaseResult releaseReservation(String reservationId) {
        requireReservationId(reservationId);
        ReleaseResult result = storage(() -> ledger.release(reservationId), "release " + reservationId);
        if (result.status() == ReleaseResult.Status.RELEASED) {
            metrics.recordBudgetRelease();
        }
        return result;
    }

    public BudgetSnapshot budgetState(String tenantId, String projectId) {
        return storage(() -> ledger.snapshot(tenantId, projectId), "budget state " + tenantId + "/" + projectId);
    }

    public BudgetSnapshot configureLimit(String tenantId, String projectId, long totalLimit, String actor) {
        BudgetSnapshot snapshot = storage(() -> {
            ledger.ensureAccount(tenantId, projectId);
            return ledger.configureLimit(tenantId, projectId, totalLimit);
        }, "configure limit " + tenantId + "/" + projectId);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("tenantId", tenantId);
        metadata.put("projectId", projectId);
        metadata.put("totalLimit", totalLimit);
        auditEventService.recordEvent(actor, "BUDGET", "LIMIT_CONFIGURED",
                "Budget limit set to " + totalLimit, metadata);
        return snapshot;
    }

    public LedgerReconciliation verify(String tenantId, String projectId) {
        return storage(() -> ledger.verify(tenantId, projectId), "verify " + tenantId + "/" + projectId);
    }

    private BudgetDecision decide(TokenRequest request) {
        return storage(() -> {
            ledger.ensureAccount(request.tenantId(), request.projectId());
            try {
                return ledger.reserve(request);
            } catch (DataIntegrityViolationException e) {
                log.info("Request {} reserved concurrently, answering from ledger", request.requestId());
                return ledger.findDecision(request.tenantId(), request.requestId()).orElseThrow(() -> e);
            }
        }, "reserve " + request.requestId());
    }

    private BudgetDecision awaitDuplicate(TokenRequest request, String key) {
        ControlPlaneProperties.Budget config = properties.getBudget();
        long deadline = System.nanoTime() + config.getDuplicateWait().toNanos();
        Duration poll = config.getDuplicatePollInterval();
        while (System.nanoTime() < deadline) {
            Optional<BudgetDecision> cached = cachedDecision(key);
            if (cached.isPresent()) {
                return cached.get();
            }
            try {
                Thread.sleep(Math.max(1L, poll.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        Optional<BudgetDecision> fromLedger = storage(
                () -> ledger.findDecision(request.tenantId(), request.requestId()), "lookup " + request.requestId());
        if (fromLedger.isPresent()) {
            return fromLedger.get();
        }
        log.warn("Budget request {} still in progress elsewhere", request.requestId());
        throw new ConflictException("Request " + request.requestId() + " is still in progress; retry with the same request id");
    }

    private Optional<BudgetDecision> cachedDecision(String key) {
        Optional<String> value = idempotencyStore.get(key);
        if (value.isEmpty() || IN_PROGRESS.equals(value.get())) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(value.get(), BudgetDecision.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cached budget decision under {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private String serialize(BudgetDecision decision) {
        try {
            return objectMapper.writeValueAsString(decision);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize budget decision", e);
        }
    }

    private void releaseMarker(String key) {
        try {
            idempotencyStore.remove(key);
        } catch (RuntimeException e) {
            log.warn("Failed to clear in-progress marker {}: {}", key, e.getMessage());
        }
    }

    private void auditDecline(TokenRequest request, BudgetDecision decision) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("tenantId", request.tenantId());
        metadata.put("projectId", request.projectId());
        metadata.put("taskId", request.taskId());
        metadata.put("requestId", request.requestId());
        metadata.put("estimatedTokens", request.estimatedTokens());
        auditEventService.recordEvent(request.tenantId(), "BUDGET", "DECLINED",
                "Token request declined: " + decision.reason(), metadata);
    }

    private void validate(TokenRequest request) {
        if (request == null) {
            throw new ValidationException("Token request is required");
        }
        Set<ConstraintViolation<TokenRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
            throw new ValidationException("Invalid token request", messages);
        }
    }

    private static void requireReservationId(String reservationId) {
        if (reservationId == null || reservationId.isBlank()) {
            throw new ValidationException("reservationId is required", List.of("reservationId: must not be blank"));
        }
    }

    private static String cacheKey(String tenantId, String requestId) {
        return "budget:req:" + tenantId + ":" + requestId;
    }

    private static <T> T storage(Supplier<T> action, String operation) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException("Budget storage failure during " + operation, e);
        }
    }
}
