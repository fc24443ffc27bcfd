package com.golden.controlplane.service.idempotency;

import com.golden.controlplane.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "control-plane.idempotency.store", havingValue = "jdbc", matchIfMissing = true)
public class IdempotencyCleanupJob {

    private final JdbcIdempotencyStore store;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${control-plane.idempotency.cleanup-interval-ms:60000}")
    public void purgeExpired() {
        scheduledTaskGuard.run("idempotency-cleanup", () -> {
            int purged = store.purgeExpired();
            if (purged > 0) {
                log.info("Purged {} expired idempotency records", purged);
            }
        });
    }
}
