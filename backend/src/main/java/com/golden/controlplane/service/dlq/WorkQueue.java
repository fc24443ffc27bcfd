package com.golden.controlplane.service.dlq;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.exception.NotFoundException;
import com.golden.controlplane.exception.ValidationException;
import com.golden.controlplane.model.WorkItem;
import com.golden.controlplane.repository.WorkItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable queue of asynchronous work items. Workers claim items with a lease; an item whose lease
 * expires goes back to PENDING so a crashed worker never strands it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkQueue {

    public enum FailureOutcome {
        RETRY_SCHEDULED,
        DEAD_LETTERED,
        IGNORED
    }

    private final WorkItemRepository workItemRepository;
    private final RetryBackoff retryBackoff;
    private final DeadLetterService deadLetterService;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    @Transactional
    public Long publish(String destination, String payload) {
        return publish(destination, payload, properties.getDeadLetter().getMaxAttempts());
    }

    @Transactional
    public Long publish(String destination, String payload, int maxAttempts) {
        if (destination == null || destination.isBlank()) {
            throw new ValidationException("destination is required");
        }
        if (payload == null) {
            throw new ValidationException("payload is required");
        }
        if (maxAttempts < 1) {
            throw new ValidationException("maxAttempts must be >= 1");
        }
        Instant now = Instant.now(clock);
        WorkItem item = workItemRepository.save(WorkItem.pending(destination, payload, maxAttempts, now));
        log.debug("Published work item {} to {}", item.getId(), destination);
        return item.getId();
    }

    @Transactional
    public List<WorkItem> claimDue(int limit) {
        Instant now = Instant.now(clock);
        Instant leaseUntil = now.plus(properties.getDeadLetter().getLease());
        List<WorkItem> claimed = new ArrayList<>();
        for (Long id : workItemRepository.findDueIds(WorkItem.Status.PENDING, now, PageRequest.of(0, Math.max(1, limit)))) {
            if (workItemRepository.claim(id, WorkItem.Status.PENDING, WorkItem.Status.IN_FLIGHT, now, leaseUntil) == 1) {
                workItemRepository.findById(id).ifPresent(claimed::add);
            }
        }
        return claimed;
    }

    @Transactional
    public int releaseExpiredLeases() {
        int released = workItemRepository.releaseExpiredLeases(WorkItem.Status.PENDING, WorkItem.Status.IN_FLIGHT,
                Instant.now(clock));
        if (released > 0) {
            log.warn("Returned {} work items with expired leases to the queue", released);
        }
        return released;
    }

    /**
     * Marks a claimed item delivered.
     *
     * @param lease the {@code leaseExpiresAt} of the caller's claim
     * @return false when the claim was lost to lease expiry and the report was ignored
     */
    @Transactional
    public boolean complete(Long id, Instant lease) {
        WorkItem item = workItemRepository.findForUpdate(id)
                .orElseThrow(() -> new NotFoundException("Work item not found: " + id));
        if (!holdsClaim(item, lease)) {
            log.warn("Ignoring completion of work item {} from a stale claim (state {})", id, item.getStatus());
            return false;
        }
        Instant now = Instant.now(clock);
        item.setStatus(WorkItem.Status.COMPLETED);
        item.setLeaseExpiresAt(null);
        item.setUpdatedAt(now);
        workItemRepository.save(item);
        return true;
    }

    /**
     * Counts one failed delivery. Below the attempt limit the item is rescheduled with backoff;
     * at the limit it is parked in the dead-letter store in the same transaction. A report from a
     * claim whose lease has since passed to another worker is ignored.
     */
    @Transactional
    public FailureOutcome recordFailure(Long id, Instant lease, String error) {
        WorkItem item = workItemRepository.findForUpdate(id)
                .orElseThrow(() -> new NotFoundException("Work item not found: " + id));
        if (!holdsClaim(item, lease)) {
            log.warn("Ignoring failure report for work item {} from a stale claim (state {})", id, item.getStatus());
            return FailureOutcome.IGNORED;
        }
        Instant now = Instant.now(clock);
        item.setAttempts(item.getAttempts() + 1);
        item.setLastError(error);
        item.setLeaseExpiresAt(null);
        item.setUpdatedAt(now);

        if (item.getAttempts() < item.getMaxAttempts()) {
            Duration delay = retryBackoff.delayAfter(item.getAttempts());
            item.setStatus(WorkItem.Status.PENDING);
            item.setNextAttemptAt(now.plus(delay));
            workItemRepository.save(item);
            log.warn("Work item {} to {} failed (attempt {}/{}), retrying in {}: {}",
                    id, item.getDestination(), item.getAttempts(), item.getMaxAttempts(), delay, error);
            return FailureOutcome.RETRY_SCHEDULED;
        }

        item.setStatus(WorkItem.Status.DEAD_LETTERED);
        workItemRepository.save(item);
        deadLetterService.park(item);
        return FailureOutcome.DEAD_LETTERED;
    }

    @Transactional(readOnly = true)
    public WorkItem get(Long id) {
        return workItemRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Work item not found: " + id));
    }

    private static boolean holdsClaim(WorkItem item, Instant lease) {
        return item.getStatus() == WorkItem.Status.IN_FLIGHT
                && lease != null
                && lease.equals(item.getLeaseExpiresAt());
    }
}
