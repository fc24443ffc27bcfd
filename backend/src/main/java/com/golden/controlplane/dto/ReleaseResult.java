package com.golden.controlplane.dto;

public record ReleaseResult(Status status, String reservationId, long released) {

    public enum Status {
        RELEASED,
        ALREADY_RELEASED
    }
}
