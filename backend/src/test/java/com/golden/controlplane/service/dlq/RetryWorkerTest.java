package com.golden.controlplane.service.dlq;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.model.WorkItem;
import com.golden.controlplane.service.ControlPlaneMetrics;
import com.golden.controlplane.service.ScheduledTaskGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryWorkerTest {

    private static final Instant LEASE = Instant.parse("2026-01-05T09:02:00Z");

    @Mock
    private WorkQueue workQueue;

    @Mock
    private ControlPlaneMetrics metrics;

    @Mock
    private ScheduledTaskGuard scheduledTaskGuard;

    private WorkItemHandlerRegistry handlers;
    private RetryWorker worker;

    @BeforeEach
    void setUp() {
        handlers = new WorkItemHandlerRegistry(List.of());
        worker = new RetryWorker(workQueue, handlers, metrics, new ControlPlaneProperties(), scheduledTaskGuard);
    }

    @Test
    void successfulDeliveryCompletesItem() {
        List<String> delivered = new ArrayList<>();
        handlers.register(handler("billing", delivered::add));

        worker.process(item(7L, "billing", "{\"invoice\":1}"));

        assertThat(delivered).containsExactly("{\"invoice\":1}");
        verify(workQueue).complete(7L, LEASE);
        verify(workQueue, never()).recordFailure(anyLong(), any(), anyString());
    }

    @Test
    void handlerExceptionIsRecordedAsFailure() {
        handlers.register(handler("billing", payload -> {
            throw new IllegalStateException("downstream 503");
        }));
        when(workQueue.recordFailure(8L, LEASE, "IllegalStateException: downstream 503"))
                .thenReturn(WorkQueue.FailureOutcome.RETRY_SCHEDULED);

        worker.process(item(8L, "billing", "{}"));

        verify(workQueue, never()).complete(anyLong(), any());
        verify(metrics).recordWorkItemRetry();
    }

    @Test
    void missingHandlerCountsAsFailure() {
        when(workQueue.recordFailure(eq(9L), eq(LEASE), anyString())).thenReturn(WorkQueue.FailureOutcome.DEAD_LETTERED);

        worker.process(item(9L, "unknown-destination", "{}"));

        verify(workQueue).recordFailure(9L, LEASE, "No handler registered for destination unknown-destination");
        verify(metrics, never()).recordWorkItemRetry();
    }

    @Test
    void failureFromLostClaimIsNotCountedAsRetry() {
        handlers.register(handler("billing", payload -> {
            throw new IllegalStateException("slow downstream");
        }));
        when(workQueue.recordFailure(eq(10L), eq(LEASE), anyString())).thenReturn(WorkQueue.FailureOutcome.IGNORED);

        worker.process(item(10L, "billing", "{}"));

        verify(metrics, never()).recordWorkItemRetry();
    }

    @Test
    void pollReleasesLeasesThenProcessesClaimedBatch() {
        List<String> delivered = new ArrayList<>();
        handlers.register(handler("email", delivered::add));
        when(workQueue.claimDue(50)).thenReturn(List.of(item(1L, "email", "a"), item(2L, "email", "b")));

        assertThat(worker.pollOnce()).isEqualTo(2);

        verify(workQueue).releaseExpiredLeases();
        verify(workQueue).complete(1L, LEASE);
        verify(workQueue).complete(2L, LEASE);
        assertThat(delivered).containsExactly("a", "b");
    }

    private static WorkItem item(Long id, String destination, String payload) {
        WorkItem item = WorkItem.pending(destination, payload, 3, Instant.parse("2026-01-05T09:00:00Z"));
        item.setId(id);
        item.setStatus(WorkItem.Status.IN_FLIGHT);
        item.setLeaseExpiresAt(LEASE);
        return item;
    }

    private static WorkItemHandler handler(String destination, ThrowingConsumer consumer) {
        return new WorkItemHandler() {
            @Override
            public String destination() {
                return destination;
            }

            @Override
            public void handle(String payload) throws Exception {
                consumer.accept(payload);
            }
        };
    }

    @FunctionalInterface
    interface ThrowingConsumer {
        void accept(String payload) throws Exception;
    }
}
