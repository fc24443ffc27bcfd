package com.golden.controlplane.dto;

public record CommitResult(Status status, String reservationId, long committed, long released) {

    public enum Status {
        COMMITTED,
        ALREADY_COMMITTED
    }
}
