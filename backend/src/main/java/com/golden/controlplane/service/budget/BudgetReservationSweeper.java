package com.golden.controlplane.service.budget;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Releases reservations that were never committed or released within the reservation TTL, so a
 * crashed caller cannot hold headroom forever.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetReservationSweeper {

    private static final int BATCH_SIZE = 100;

    private final BudgetLedger ledger;
    private final IdempotentBudgetController controller;
    private final ControlPlaneProperties properties;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${control-plane.budget.sweep-interval-ms:60000}")
    public void scheduledSweep() {
        scheduledTaskGuard.run("budget-reservation-sweeper", this::sweepStaleReservations);
    }

    public int sweepStaleReservations() {
        Instant cutoff = Instant.now(clock).minus(properties.getBudget().getReservationTtl());
        List<String> stale = ledger.findStaleReservationIds(cutoff, BATCH_SIZE);
        int released = 0;
        for (String reservationId : stale) {
            MDC.put("reservationId", reservationId);
            try {
                controller.releaseReservation(reservationId);
                released++;
                log.warn("Sweeper released stale reservation {}", reservationId);
            } catch (ConflictException e) {
                log.debug("Reservation {} finalized before sweep: {}", reservationId, e.getMessage());
            } finally {
                MDC.remove("reservationId");
            }
        }
        return released;
    }
}
