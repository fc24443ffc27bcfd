package com.golden.controlplane.service.governance;

import com.golden.controlplane.dto.GovernanceDecision;
import com.golden.controlplane.dto.GovernanceStatus;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.exception.NotFoundException;
import com.golden.controlplane.exception.StorageException;
import com.golden.controlplane.exception.ValidationException;
import com.golden.controlplane.model.GovernanceRule;
import com.golden.controlplane.model.LearningUpdate;
import com.golden.controlplane.repository.GovernanceRuleRepository;
import com.golden.controlplane.repository.LearningUpdateRepository;
import com.golden.controlplane.service.AuditEventService;
import com.golden.controlplane.service.ControlPlaneMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Per-role gate on automatic learning updates.
 * <p>
 * Check-then-record for one role runs under that role's row lock, so concurrent callers can never
 * jointly exceed the daily cap. Only AUTO_APPLIED updates count toward the cap.
 */
@Service
@Slf4j
public class GovernanceLimiter {

    private static final Duration WINDOW = Duration.ofHours(24);

    private final GovernanceRuleRepository ruleRepository;
    private final LearningUpdateRepository updateRepository;
    private final GovernanceRuleProvisioner provisioner;
    private final AuditEventService auditEventService;
    private final ControlPlaneMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;

    public GovernanceLimiter(GovernanceRuleRepository ruleRepository,
                             LearningUpdateRepository updateRepository,
                             GovernanceRuleProvisioner provisioner,
                             AuditEventService auditEventService,
                             ControlPlaneMetrics metrics,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.ruleRepository = ruleRepository;
        this.updateRepository = updateRepository;
        this.provisioner = provisioner;
        this.auditEventService = auditEventService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.clock = clock;
    }

    public boolean canAutoUpdate(String role) {
        return evaluate(role).allowed();
    }

    /**
     * Same check as {@link #canAutoUpdate(String)} with the reason attached. Does not record anything.
     */
    public GovernanceDecision evaluate(String role) {
        requireRole(role);
        GovernanceDecision decision = inTransaction(readOnlyTemplate, () -> ruleRepository.findById(role)
                .map(rule -> decide(rule, Instant.now(clock)))
                .orElseGet(() -> GovernanceDecision.denied(role, GovernanceDecision.Reason.UNKNOWN_ROLE, null)));
        metrics.recordGovernanceDecision(decision.reason().name().toLowerCase());
        return decision;
    }

    /**
     * Records an automatic update for the role, creating the rule with defaults if the role is new.
     */
    public void recordUpdate(String role) {
        recordUpdate(role, null);
    }

    public Long recordUpdate(String role, String description) {
        requireRole(role);
        ensureRule(role);
        return inTransaction(transactionTemplate, () -> {
            GovernanceRule rule = lockRule(role);
            Instant now = Instant.now(clock);
            markUpdated(rule, now);
            return saveUpdate(role, description, LearningUpdate.Status.AUTO_APPLIED, null, now).getId();
        });
    }

    /**
     * Atomic check-and-record. A denied update is parked for human review and its id returned in
     * the decision.
     */
    public GovernanceDecision tryAutoUpdate(String role, String description) {
        requireRole(role);
        GovernanceDecision decision = inTransaction(transactionTemplate, () -> {
            Instant now = Instant.now(clock);
            GovernanceDecision verdict = ruleRepository.findForUpdate(role)
                    .map(rule -> {
                        GovernanceDecision d = decide(rule, now);
                        if (d.allowed()) {
                            markUpdated(rule, now);
                            return d.withUpdateId(saveUpdate(role, description, LearningUpdate.Status.AUTO_APPLIED, null, now).getId());
                        }
                        return d;
                    })
                    .orElseGet(() -> GovernanceDecision.denied(role, GovernanceDecision.Reason.UNKNOWN_ROLE, null));
            if (!verdict.allowed()) {
                verdict = verdict.withUpdateId(saveUpdate(role, description, LearningUpdate.Status.PENDING_REVIEW, null, now).getId());
            }
            return verdict;
        });
        metrics.recordGovernanceDecision(decision.reason().name().toLowerCase());
        if (decision.allowed()) {
            log.info("Auto update applied for role {} (update {})", role, decision.updateId());
        } else {
            log.info("Auto update for role {} denied: {} (parked as update {})", role, decision.reason(), decision.updateId());
        }
        return decision;
    }

    public Long submitForApproval(String role, String description, String requestedBy) {
        requireRole(role);
        Long id = inTransaction(transactionTemplate, () -> saveUpdate(role, description,
                LearningUpdate.Status.PENDING_REVIEW, requestedBy, Instant.now(clock)).getId());
        log.info("Learning update {} for role {} submitted for approval by {}", id, role, requestedBy);
        return id;
    }

    /**
     * Applies a parked update. Counts for cooldown and audit but not toward the daily auto cap.
     */
    public LearningUpdate approve(Long updateId, String approver, String note) {
        LearningUpdate pending = inTransaction(readOnlyTemplate, () -> updateRepository.findById(updateId))
                .orElseThrow(() -> new NotFoundException("Learning update not found: " + updateId));
        ensureRule(pending.getRole());
        LearningUpdate approved = inTransaction(transactionTemplate, () -> {
            LearningUpdate update = lockPending(updateId);
            GovernanceRule rule = lockRule(update.getRole());
            Instant now = Instant.now(clock);
            markUpdated(rule, now);
            update.setStatus(LearningUpdate.Status.HUMAN_APPROVED);
            update.setReviewer(approver);
            update.setReviewNote(note);
            update.setReviewedAt(now);
            return updateRepository.save(update);
        });
        audit(approver, "APPROVED", approved, note);
        return approved;
    }

    public LearningUpdate reject(Long updateId, String approver, String reason) {
        LearningUpdate rejected = inTransaction(transactionTemplate, () -> {
            LearningUpdate update = lockPending(updateId);
            update.setStatus(LearningUpdate.Status.REJECTED);
            update.setReviewer(approver);
            update.setReviewNote(reason);
            update.setReviewedAt(Instant.now(clock));
            return updateRepository.save(update);
        });
        audit(approver, "REJECTED", rejected, reason);
        return rejected;
    }

    /**
     * Pending review count per role.
     */
    public Map<String, Long> pendingApprovals() {
        return inTransaction(readOnlyTemplate, () -> {
            Map<String, Long> counts = new TreeMap<>();
            for (LearningUpdate update : updateRepository.findByStatusOrderByCreatedAtAsc(LearningUpdate.Status.PENDING_REVIEW)) {
                counts.merge(update.getRole(), 1L, Long::sum);
            }
            return counts;
        });
    }

    public List<GovernanceStatus> status() {
        return inTransaction(readOnlyTemplate, () -> {
            Instant now = Instant.now(clock);
            return ruleRepository.findAllByOrderByRoleAsc().stream()
                    .map(rule -> toStatus(rule, now))
                    .toList();
        });
    }

    public GovernanceRule defineRule(String role, int maxUpdatesPerDay, Duration cooldown,
                                     boolean requiresHumanApproval, String actor) {
        requireRole(role);
        if (maxUpdatesPerDay < 0) {
            throw new ValidationException("maxUpdatesPerDay must be >= 0");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new ValidationException("cooldown must be >= 0");
        }
        ensureRule(role);
        GovernanceRule saved = inTransaction(transactionTemplate, () -> {
            GovernanceRule rule = lockRule(role);
            rule.setMaxUpdatesPerDay(maxUpdatesPerDay);
            rule.setCooldownSeconds(cooldown.toSeconds());
            rule.setRequiresHumanApproval(requiresHumanApproval);
            rule.setUpdatedAt(Instant.now(clock));
            return ruleRepository.save(rule);
        });
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("role", role);
        metadata.put("maxUpdatesPerDay", maxUpdatesPerDay);
        metadata.put("cooldownSeconds", cooldown.toSeconds());
        metadata.put("requiresHumanApproval", requiresHumanApproval);
        auditEventService.recordEvent(actor, "GOVERNANCE", "RULE_DEFINED", "Governance rule updated for " + role, metadata);
        return saved;
    }

    private GovernanceDecision decide(GovernanceRule rule, Instant now) {
        if (rule.isRequiresHumanApproval()) {
            return GovernanceDecision.denied(rule.getRole(), GovernanceDecision.Reason.REQUIRES_HUMAN_APPROVAL, null);
        }
        if (rule.getLastUpdateAt() != null) {
            Instant cooldownEnds = rule.getLastUpdateAt().plus(rule.cooldown());
            if (now.isBefore(cooldownEnds)) {
                return GovernanceDecision.denied(rule.getRole(), GovernanceDecision.Reason.COOLDOWN_ACTIVE, cooldownEnds);
            }
        }
        if (autoUpdatesInWindow(rule.getRole(), now) >= rule.getMaxUpdatesPerDay()) {
            return GovernanceDecision.denied(rule.getRole(), GovernanceDecision.Reason.DAILY_LIMIT_REACHED, null);
        }
        return GovernanceDecision.allowed(rule.getRole());
    }

    private GovernanceStatus toStatus(GovernanceRule rule, Instant now) {
        long recent = autoUpdatesInWindow(rule.getRole(), now);
        long pending = updateRepository.countByRoleAndStatus(rule.getRole(), LearningUpdate.Status.PENDING_REVIEW);
        String status;
        if (rule.isRequiresHumanApproval()) {
            status = GovernanceStatus.REQUIRES_APPROVAL;
        } else if (recent >= rule.getMaxUpdatesPerDay()) {
            status = GovernanceStatus.DAILY_LIMIT_REACHED;
        } else if (rule.getLastUpdateAt() != null && now.isBefore(rule.getLastUpdateAt().plus(rule.cooldown()))) {
            status = GovernanceStatus.COOLDOWN_ACTIVE;
        } else {
            status = GovernanceStatus.CAN_AUTO_UPDATE;
        }
        return new GovernanceStatus(rule.getRole(), rule.getMaxUpdatesPerDay(), rule.cooldown(),
                rule.isRequiresHumanApproval(), rule.getLastUpdateAt(), recent, pending, status);
    }

    private long autoUpdatesInWindow(String role, Instant now) {
        return updateRepository.countByRoleAndStatusAndCreatedAtAfter(role, LearningUpdate.Status.AUTO_APPLIED, now.minus(WINDOW));
    }

    private void ensureRule(String role) {
        if (inTransaction(readOnlyTemplate, () -> ruleRepository.existsById(role))) {
            return;
        }
        try {
            provisioner.createDefault(role);
        } catch (DataIntegrityViolationException e) {
            log.debug("Governance rule for {} created concurrently", role);
        }
    }

    private GovernanceRule lockRule(String role) {
        return ruleRepository.findForUpdate(role)
                .orElseThrow(() -> new NotFoundException("Governance rule not found: " + role));
    }

    private LearningUpdate lockPending(Long updateId) {
        LearningUpdate update = updateRepository.findForUpdate(updateId)
                .orElseThrow(() -> new NotFoundException("Learning update not found: " + updateId));
        if (update.getStatus() != LearningUpdate.Status.PENDING_REVIEW) {
            throw new ConflictException("Learning update " + updateId + " is " + update.getStatus());
        }
        return update;
    }

    private void markUpdated(GovernanceRule rule, Instant now) {
        rule.setLastUpdateAt(now);
        rule.setUpdatedAt(now);
        ruleRepository.save(rule);
    }

    private LearningUpdate saveUpdate(String role, String description, LearningUpdate.Status status,
                                      String requestedBy, Instant now) {
        return updateRepository.save(LearningUpdate.builder()
                .role(role)
                .description(description)
                .status(status)
                .requestedBy(requestedBy)
                .createdAt(now)
                .build());
    }

    private void audit(String actor, String action, LearningUpdate update, String note) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("updateId", update.getId());
        metadata.put("role", update.getRole());
        auditEventService.recordEvent(actor, "GOVERNANCE", action,
                note == null ? "Learning update " + action.toLowerCase() : note, metadata);
    }

    private static void requireRole(String role) {
        if (role == null || role.isBlank()) {
            throw new ValidationException("role is required", List.of("role: must not be blank"));
        }
    }

    private static <T> T inTransaction(TransactionTemplate template, Supplier<T> action) {
        try {
            return template.execute(status -> action.get());
        } catch (DataAccessException e) {
            throw new StorageException("Governance storage failure", e);
        }
    }
}
