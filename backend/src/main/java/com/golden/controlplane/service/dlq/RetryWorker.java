package com.golden.controlplane.service.dlq;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.model.WorkItem;
import com.golden.controlplane.service.ControlPlaneMetrics;
import com.golden.controlplane.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Delivers due work items to their destination handler. Several instances may poll the same
 * queue; the claim in {@link WorkQueue#claimDue(int)} keeps them from delivering one item twice
 * concurrently.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetryWorker {

    private final WorkQueue workQueue;
    private final WorkItemHandlerRegistry handlers;
    private final ControlPlaneMetrics metrics;
    private final ControlPlaneProperties properties;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${control-plane.dead-letter.poll-interval-ms:1000}")
    public void scheduledPoll() {
        scheduledTaskGuard.run("retry-worker", this::pollOnce);
    }

    /**
     * @return number of items processed
     */
    public int pollOnce() {
        workQueue.releaseExpiredLeases();
        List<WorkItem> claimed = workQueue.claimDue(properties.getDeadLetter().getBatchSize());
        claimed.forEach(this::process);
        return claimed.size();
    }

    void process(WorkItem item) {
        MDC.put("workItemId", String.valueOf(item.getId()));
        try {
            Optional<WorkItemHandler> handler = handlers.find(item.getDestination());
            if (handler.isEmpty()) {
                fail(item, "No handler registered for destination " + item.getDestination());
                return;
            }
            try {
                handler.get().handle(item.getPayload());
            } catch (Exception e) {
                fail(item, describe(e));
                return;
            }
            if (workQueue.complete(item.getId(), item.getLeaseExpiresAt())) {
                log.debug("Work item {} delivered to {}", item.getId(), item.getDestination());
            }
        } finally {
            MDC.remove("workItemId");
        }
    }

    private void fail(WorkItem item, String error) {
        WorkQueue.FailureOutcome outcome = workQueue.recordFailure(item.getId(), item.getLeaseExpiresAt(), error);
        if (outcome == WorkQueue.FailureOutcome.RETRY_SCHEDULED) {
            metrics.recordWorkItemRetry();
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
