package com.golden.controlplane.dto;

import java.time.Instant;

/**
 * Answer of the learning-update gate. A denial is data, not an error.
 *
 * @param retryAt        when a cooldown denial lifts, otherwise null
 * @param updateId       applied update for an allowed attempt, or the update parked for review on denial
 */
public record GovernanceDecision(String role, boolean allowed, Reason reason, Instant retryAt, Long updateId) {

    public enum Reason {
        ALLOWED,
        REQUIRES_HUMAN_APPROVAL,
        COOLDOWN_ACTIVE,
        DAILY_LIMIT_REACHED,
        UNKNOWN_ROLE
    }

    public static GovernanceDecision allowed(String role) {
        return new GovernanceDecision(role, true, Reason.ALLOWED, null, null);
    }

    public static GovernanceDecision denied(String role, Reason reason, Instant retryAt) {
        return new GovernanceDecision(role, false, reason, retryAt, null);
    }

    public GovernanceDecision withUpdateId(Long id) {
        return new GovernanceDecision(role, allowed, reason, retryAt, id);
    }
}
