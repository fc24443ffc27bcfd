package com.golden.controlplane.service.dlq;

import com.golden.controlplane.dto.ResolveResult;
import com.golden.controlplane.event.CriticalAlertEvent;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.exception.ValidationException;
import com.golden.controlplane.model.DeadLetterMessage;
import com.golden.controlplane.model.WorkItem;
import com.golden.controlplane.repository.AuditEventRepository;
import com.golden.controlplane.repository.DeadLetterMessageRepository;
import com.golden.controlplane.repository.WorkItemRepository;
import com.golden.controlplane.testutil.MutableClock;
import com.golden.controlplane.testutil.TestClockConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
@RecordApplicationEvents
class DeadLetterIntegrationTest {

    @Autowired
    private WorkQueue workQueue;

    @Autowired
    private RetryWorker retryWorker;

    @Autowired
    private DeadLetterService deadLetterService;

    @Autowired
    private WorkItemHandlerRegistry handlers;

    @Autowired
    private WorkItemRepository workItemRepository;

    @Autowired
    private DeadLetterMessageRepository deadLetterRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ApplicationEvents events;

    private String destination;
    private final AtomicInteger deliveries = new AtomicInteger();

    @BeforeEach
    void setUp() {
        destination = "dest-" + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        handlers.unregister(destination);
    }

    @Test
    void failingWorkIsParkedAfterMaxAttemptsWithOneAlert() {
        handlers.register(handler(() -> {
            throw new IllegalStateException("downstream unavailable");
        }));
        Long itemId = workQueue.publish(destination, "{\"job\":42}");

        retryWorker.pollOnce();
        assertThat(workQueue.get(itemId).getStatus()).isEqualTo(WorkItem.Status.PENDING);
        assertThat(workQueue.get(itemId).getAttempts()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(3));
        retryWorker.pollOnce();
        clock.advance(Duration.ofSeconds(5));
        retryWorker.pollOnce();

        assertThat(deliveries).hasValue(3);
        assertThat(workQueue.get(itemId).getStatus()).isEqualTo(WorkItem.Status.DEAD_LETTERED);
        List<DeadLetterMessage> parked = deadLetterRepository.findByOriginalDestinationOrderByIdAsc(destination);
        assertThat(parked).singleElement().satisfies(message -> {
            assertThat(message.isResolved()).isFalse();
            assertThat(message.getAttemptCount()).isEqualTo(3);
            assertThat(message.getPayload()).isEqualTo("{\"job\":42}");
            assertThat(message.getSourceWorkItemId()).isEqualTo(itemId);
            assertThat(message.getLastError()).contains("downstream unavailable");
        });
        assertThat(alertsFor(destination)).hasSize(1);

        clock.advance(Duration.ofMinutes(1));
        retryWorker.pollOnce();
        assertThat(deliveries).hasValue(3);
    }

    @Test
    void backoffDefersRetryUntilDue() {
        handlers.register(handler(() -> {
            throw new IllegalStateException("boom");
        }));
        Long itemId = workQueue.publish(destination, "{}");

        retryWorker.pollOnce();
        retryWorker.pollOnce();

        assertThat(deliveries).hasValue(1);
        assertThat(workQueue.get(itemId).getNextAttemptAt()).isEqualTo(clock.instant().plusSeconds(2));
    }

    @Test
    void successfulDeliveryCompletesItem() {
        handlers.register(handler(() -> { }));
        Long itemId = workQueue.publish(destination, "{}");

        retryWorker.pollOnce();

        assertThat(workQueue.get(itemId).getStatus()).isEqualTo(WorkItem.Status.COMPLETED);
        assertThat(deadLetterRepository.findByOriginalDestinationOrderByIdAsc(destination)).isEmpty();
    }

    @Test
    void requeueResetsAttemptsAndRepublishesToOriginalDestination() {
        Long messageId = deadLetterService.enqueue(destination, "{\"order\":7}", "timeout");
        assertThat(alertsFor(destination)).hasSize(1);

        ResolveResult result = deadLetterService.resolve(messageId, "downstream fixed", true, "ops");

        assertThat(result.status()).isEqualTo(ResolveResult.RESOLVED);
        assertThat(result.requeued()).isTrue();
        DeadLetterMessage message = deadLetterService.get(messageId);
        assertThat(message.isResolved()).isTrue();
        assertThat(message.getAttemptCount()).isZero();
        assertThat(message.getResolvedBy()).isEqualTo("ops");
        assertThat(message.getResolutionNote()).isEqualTo("downstream fixed");

        List<WorkItem> republished = workItemRepository.findByDestinationOrderByIdAsc(destination);
        assertThat(republished).singleElement().satisfies(item -> {
            assertThat(item.getId()).isEqualTo(result.workItemId());
            assertThat(item.getStatus()).isEqualTo(WorkItem.Status.PENDING);
            assertThat(item.getAttempts()).isZero();
            assertThat(item.getPayload()).isEqualTo("{\"order\":7}");
        });

        handlers.register(handler(() -> { }));
        retryWorker.pollOnce();
        assertThat(workQueue.get(result.workItemId()).getStatus()).isEqualTo(WorkItem.Status.COMPLETED);
    }

    @Test
    void resolvingTwiceConflicts() {
        Long messageId = deadLetterService.enqueue(destination, "{}", "bad payload");
        deadLetterService.resolve(messageId, "dropped", false, "ops");

        assertThatThrownBy(() -> deadLetterService.resolve(messageId, "again", true, "ops"))
                .isInstanceOf(ConflictException.class);
        assertThat(workItemRepository.findByDestinationOrderByIdAsc(destination)).isEmpty();
    }

    @Test
    void longResolutionNoteStillResolvesAndAuditIsTruncated() {
        Long messageId = deadLetterService.enqueue(destination, "{}", "bad payload");
        String note = "n".repeat(600);

        ResolveResult result = deadLetterService.resolve(messageId, note, false, "ops");

        assertThat(result.status()).isEqualTo(ResolveResult.RESOLVED);
        DeadLetterMessage message = deadLetterService.get(messageId);
        assertThat(message.isResolved()).isTrue();
        assertThat(message.getResolvedBy()).isEqualTo("ops");
        assertThat(auditEventRepository.findByEventTypeAndActionOrderByCreatedAtDesc("DEAD_LETTER", "DROPPED"))
                .anySatisfy(event -> {
                    assertThat(event.getDescription()).hasSize(512);
                    assertThat(event.getMetadata()).contains(String.valueOf(messageId));
                });
    }

    @Test
    void listingFiltersByResolutionNewestFirst() {
        Long first = deadLetterService.enqueue(destination, "1", "e1");
        clock.advance(Duration.ofSeconds(1));
        Long second = deadLetterService.enqueue(destination, "2", "e2");
        deadLetterService.resolve(first, null, false, "ops");

        assertThat(deadLetterService.list(false, 500, 0))
                .extracting(DeadLetterMessage::getId)
                .contains(second)
                .doesNotContain(first);
        assertThat(deadLetterService.list(null, 2, 0))
                .extracting(DeadLetterMessage::getId)
                .startsWith(second, first);
        assertThatThrownBy(() -> deadLetterService.list(null, 0, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> deadLetterService.enqueue(" ", "{}", "e")).isInstanceOf(ValidationException.class);
    }

    @Test
    void expiredLeaseReturnsItemToQueue() {
        Long itemId = workQueue.publish(destination, "{}");

        List<WorkItem> claimed = workQueue.claimDue(500);
        assertThat(claimed).extracting(WorkItem::getId).contains(itemId);
        assertThat(workQueue.claimDue(500)).extracting(WorkItem::getId).doesNotContain(itemId);

        clock.advance(Duration.ofMinutes(3));
        assertThat(workQueue.releaseExpiredLeases()).isGreaterThanOrEqualTo(1);

        WorkItem item = workQueue.get(itemId);
        assertThat(item.getStatus()).isEqualTo(WorkItem.Status.PENDING);
        assertThat(item.getAttempts()).isZero();
    }

    @Test
    void reportsFromAnExpiredClaimAreIgnored() {
        Long itemId = workQueue.publish(destination, "{}");
        Instant staleLease = leaseOf(workQueue.claimDue(500), itemId);

        clock.advance(Duration.ofMinutes(3));
        workQueue.releaseExpiredLeases();
        Instant currentLease = leaseOf(workQueue.claimDue(500), itemId);
        assertThat(currentLease).isAfter(staleLease);

        assertThat(workQueue.recordFailure(itemId, staleLease, "late failure"))
                .isEqualTo(WorkQueue.FailureOutcome.IGNORED);
        assertThat(workQueue.complete(itemId, staleLease)).isFalse();
        WorkItem item = workQueue.get(itemId);
        assertThat(item.getStatus()).isEqualTo(WorkItem.Status.IN_FLIGHT);
        assertThat(item.getAttempts()).isZero();
        assertThat(item.getLastError()).isNull();

        assertThat(workQueue.complete(itemId, currentLease)).isTrue();
        assertThat(workQueue.get(itemId).getStatus()).isEqualTo(WorkItem.Status.COMPLETED);
        assertThat(workQueue.complete(itemId, currentLease)).isFalse();
    }

    private static Instant leaseOf(List<WorkItem> claimed, Long itemId) {
        return claimed.stream()
                .filter(item -> item.getId().equals(itemId))
                .findFirst()
                .orElseThrow()
                .getLeaseExpiresAt();
    }

    private List<CriticalAlertEvent> alertsFor(String dest) {
        return events.stream(CriticalAlertEvent.class)
                .filter(e -> "RETRIES_EXHAUSTED".equals(e.type()))
                .filter(e -> dest.equals(e.metadata().get("destination")))
                .toList();
    }

    private WorkItemHandler handler(Runnable body) {
        return new WorkItemHandler() {
            @Override
            public String destination() {
                return destination;
            }

            @Override
            public void handle(String payload) {
                deliveries.incrementAndGet();
                body.run();
            }
        };
    }
}
