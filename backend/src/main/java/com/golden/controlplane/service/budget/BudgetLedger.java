package com.golden.controlplane.service.budget;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.dto.BudgetDecision;
import com.golden.controlplane.dto.BudgetSnapshot;
import com.golden.controlplane.dto.CommitResult;
import com.golden.controlplane.dto.LedgerReconciliation;
import com.golden.controlplane.dto.ReleaseResult;
import com.golden.controlplane.dto.TokenRequest;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.exception.NotFoundException;
import com.golden.controlplane.exception.ValidationException;
import com.golden.controlplane.model.BudgetAccount;
import com.golden.controlplane.model.BudgetReservation;
import com.golden.controlplane.model.BudgetTransaction;
import com.golden.controlplane.repository.BudgetAccountRepository;
import com.golden.controlplane.repository.BudgetReservationRepository;
import com.golden.controlplane.repository.BudgetTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable per (tenant, project) token accounts with an append-only transaction log.
 * <p>
 * Every mutation runs in one transaction holding the account row lock, so {@code used + reserved}
 * never exceeds {@code total_limit} whatever the interleaving. Commit and release lock the
 * reservation row before the account row; reserve only locks the account.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetLedger {

    private final BudgetAccountRepository accountRepository;
    private final BudgetReservationRepository reservationRepository;
    private final BudgetTransactionRepository transactionRepository;
    private final BudgetAccountProvisioner provisioner;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    /**
     * Creates the account with the default limit if it does not exist yet. Runs outside any
     * caller transaction.
     */
    public BudgetAccount ensureAccount(String tenantId, String projectId) {
        Optional<BudgetAccount> existing = accountRepository.findByTenantIdAndProjectId(tenantId, projectId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return provisioner.create(tenantId, projectId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Budget account tenant={} project={} created concurrently", tenantId, projectId);
            return accountRepository.findByTenantIdAndProjectId(tenantId, projectId)
                    .orElseThrow(() -> e);
        }
    }

    /**
     * Atomic check-and-reserve. A request id the ledger has already reserved for is answered from the
     * existing reservation.
     */
    @Transactional
    public BudgetDecision reserve(TokenRequest request) {
        BudgetAccount account = accountRepository.findForUpdate(request.tenantId(), request.projectId())
                .orElseThrow(() -> new NotFoundException("Budget account not found: "
                        + request.tenantId() + "/" + request.projectId()));

        Optional<BudgetReservation> existing = reservationRepository.findByTenantIdAndRequestId(
                request.tenantId(), request.requestId());
        if (existing.isPresent()) {
            log.info("Request {} already reserved as {}", request.requestId(), existing.get().getReservationId());
            return toDecision(existing.get());
        }

        long amount = request.estimatedTokens();
        // compared against headroom so a huge estimate cannot overflow into an approval
        if (amount > account.available()) {
            log.info("Declined request {} tenant={} project={} requested={} available={}",
                    request.requestId(), request.tenantId(), request.projectId(), amount, account.available());
            return BudgetDecision.declined(BudgetDecision.INSUFFICIENT_FUNDS);
        }

        Instant now = Instant.now(clock);
        BudgetReservation reservation = reservationRepository.saveAndFlush(BudgetReservation.builder()
                .reservationId(UUID.randomUUID().toString())
                .tenantId(request.tenantId())
                .projectId(request.projectId())
                .requestId(request.requestId())
                .taskId(request.taskId())
                .model(request.model())
                .purpose(request.purpose())
                .amount(amount)
                .status(BudgetReservation.Status.RESERVED)
                .createdAt(now)
                .build());

        account.setReserved(account.getReserved() + amount);
        account.setUpdatedAt(now);
        accountRepository.save(account);
        append(reservation, BudgetTransaction.Type.RESERVE, amount, now);

        log.info("Reserved {} tokens for request {} reservation={}", amount, request.requestId(), reservation.getReservationId());
        return toDecision(reservation);
    }

    @Transactional(readOnly = true)
    public Optional<BudgetDecision> findDecision(String tenantId, String requestId) {
        return reservationRepository.findByTenantIdAndRequestId(tenantId, requestId).map(this::toDecision);
    }

    @Transactional
    public CommitResult commit(String reservationId, long actualTokens) {
        BudgetReservation reservation = lockReservation(reservationId);
        if (reservation.getStatus() == BudgetReservation.Status.COMMITTED) {
            return new CommitResult(CommitResult.Status.ALREADY_COMMITTED, reservationId,
                    nullToZero(reservation.getCommittedAmount()), nullToZero(reservation.getReleasedAmount()));
        }
        if (reservation.getStatus() == BudgetReservation.Status.RELEASED) {
            throw new ConflictException("Reservation " + reservationId + " was already released");
        }
        if (actualTokens < 0 || actualTokens > reservation.getAmount()) {
            throw new ValidationException("actualTokens must be between 0 and " + reservation.getAmount());
        }

        BudgetAccount account = lockAccount(reservation);
        long remainder = reservation.getAmount() - actualTokens;
        Instant now = Instant.now(clock);

        account.setReserved(account.getReserved() - reservation.getAmount());
        account.setUsed(account.getUsed() + actualTokens);
        account.setUpdatedAt(now);
        accountRepository.save(account);

        reservation.setStatus(BudgetReservation.Status.COMMITTED);
        reservation.setCommittedAmount(actualTokens);
        reservation.setReleasedAmount(remainder);
        reservation.setFinalizedAt(now);
        reservationRepository.save(reservation);

        append(reservation, BudgetTransaction.Type.COMMIT, actualTokens, now);
        if (remainder > 0) {
            append(reservation, BudgetTransaction.Type.RELEASE, remainder, now);
        }
        log.info("Committed {} tokens for reservation {} (released {})", actualTokens, reservationId, remainder);
        return new CommitResult(CommitResult.Status.COMMITTED, reservationId, actualTokens, remainder);
    }

    @Transactional
    public ReleaseResult release(String reservationId) {
        BudgetReservation reservation = lockReservation(reservationId);
        if (reservation.getStatus() == BudgetReservation.Status.RELEASED) {
            return new ReleaseResult(ReleaseResult.Status.ALREADY_RELEASED, reservationId,
                    nullToZero(reservation.getReleasedAmount()));
        }
        if (reservation.getStatus() == BudgetReservation.Status.COMMITTED) {
            throw new ConflictException("Reservation " + reservationId + " was already committed");
        }

        BudgetAccount account = lockAccount(reservation);
        Instant now = Instant.now(clock);
        account.setReserved(account.getReserved() - reservation.getAmount());
        account.setUpdatedAt(now);
        accountRepository.save(account);

        reservation.setStatus(BudgetReservation.Status.RELEASED);
        reservation.setReleasedAmount(reservation.getAmount());
        reservation.setFinalizedAt(now);
        reservationRepository.save(reservation);

        append(reservation, BudgetTransaction.Type.RELEASE, reservation.getAmount(), now);
        log.info("Released reservation {} ({} tokens)", reservationId, reservation.getAmount());
        return new ReleaseResult(ReleaseResult.Status.RELEASED, reservationId, reservation.getAmount());
    }

    @Transactional(readOnly = true)
    public BudgetSnapshot snapshot(String tenantId, String projectId) {
        return accountRepository.findByTenantIdAndProjectId(tenantId, projectId)
                .map(account -> new BudgetSnapshot(tenantId, projectId, account.getTotalLimit(),
                        account.getUsed(), account.getReserved(), account.available()))
                .orElseGet(() -> {
                    long limit = properties.getBudget().getDefaultTotalLimit();
                    return new BudgetSnapshot(tenantId, projectId, limit, 0L, 0L, limit);
                });
    }

    /**
     * Changes the account limit. Refuses a limit below what is already used or reserved.
     */
    @Transactional
    public BudgetSnapshot configureLimit(String tenantId, String projectId, long totalLimit) {
        if (totalLimit < 0) {
            throw new ValidationException("totalLimit must be >= 0");
        }
        BudgetAccount account = accountRepository.findForUpdate(tenantId, projectId)
                .orElseThrow(() -> new NotFoundException("Budget account not found: " + tenantId + "/" + projectId));
        long committed = account.getUsed() + account.getReserved();
        if (totalLimit < committed) {
            throw new ConflictException("Limit " + totalLimit + " is below used+reserved " + committed);
        }
        account.setTotalLimit(totalLimit);
        account.setUpdatedAt(Instant.now(clock));
        accountRepository.save(account);
        return new BudgetSnapshot(tenantId, projectId, totalLimit, account.getUsed(), account.getReserved(), account.available());
    }

    /**
     * Replays the transaction log and compares it with the live account fields.
     */
    @Transactional(readOnly = true)
    public LedgerReconciliation verify(String tenantId, String projectId) {
        BudgetAccount account = accountRepository.findByTenantIdAndProjectId(tenantId, projectId)
                .orElseThrow(() -> new NotFoundException("Budget account not found: " + tenantId + "/" + projectId));
        List<BudgetTransaction> transactions = transactionRepository.findByTenantIdAndProjectIdOrderByIdAsc(tenantId, projectId);
        long used = 0;
        long reserved = 0;
        for (BudgetTransaction txn : transactions) {
            switch (txn.getType()) {
                case RESERVE -> reserved += txn.getAmount();
                case COMMIT -> {
                    reserved -= txn.getAmount();
                    used += txn.getAmount();
                }
                case RELEASE -> reserved -= txn.getAmount();
            }
        }
        return new LedgerReconciliation(tenantId, projectId, account.getUsed(), account.getReserved(),
                used, reserved, transactions.size());
    }

    @Transactional(readOnly = true)
    public List<BudgetAccount> accounts() {
        return accountRepository.findAll();
    }

    @Transactional(readOnly = true)
    public List<String> findStaleReservationIds(Instant cutoff, int limit) {
        return reservationRepository.findReservationIdsCreatedBefore(BudgetReservation.Status.RESERVED, cutoff,
                PageRequest.of(0, limit));
    }

    private BudgetReservation lockReservation(String reservationId) {
        return reservationRepository.findForUpdate(reservationId)
                .orElseThrow(() -> new NotFoundException("Reservation not found: " + reservationId));
    }

    private BudgetAccount lockAccount(BudgetReservation reservation) {
        return accountRepository.findForUpdate(reservation.getTenantId(), reservation.getProjectId())
                .orElseThrow(() -> new NotFoundException("Budget account not found: "
                        + reservation.getTenantId() + "/" + reservation.getProjectId()));
    }

    private void append(BudgetReservation reservation, BudgetTransaction.Type type, long amount, Instant at) {
        transactionRepository.save(BudgetTransaction.builder()
                .tenantId(reservation.getTenantId())
                .projectId(reservation.getProjectId())
                .requestId(reservation.getRequestId())
                .reservationId(reservation.getReservationId())
                .taskId(reservation.getTaskId())
                .purpose(reservation.getPurpose())
                .type(type)
                .amount(amount)
                .createdAt(at)
                .build());
    }

    private BudgetDecision toDecision(BudgetReservation reservation) {
        return BudgetDecision.approved(reservation.getReservationId(), reservation.getAmount());
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
