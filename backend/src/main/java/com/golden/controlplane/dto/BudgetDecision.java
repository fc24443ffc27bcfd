package com.golden.controlplane.dto;

/**
 * Outcome of a token request. A decline is an ordinary answer, not an error.
 */
public record BudgetDecision(boolean approved, String reservationId, long allocated, String reason) {

    public static final String INSUFFICIENT_FUNDS = "insufficient_funds";

    public static BudgetDecision approved(String reservationId, long allocated) {
        return new BudgetDecision(true, reservationId, allocated, null);
    }

    public static BudgetDecision declined(String reason) {
        return new BudgetDecision(false, null, 0L, reason);
    }
}
