package com.golden.controlplane.exception;

public class RetriesExhaustedException extends ControlPlaneException {
    private final String destination;
    private final int attempts;

    public RetriesExhaustedException(String destination, int attempts, String lastError) {
        super("Delivery to " + destination + " failed after " + attempts + " attempts: " + lastError);
        this.destination = destination;
        this.attempts = attempts;
    }

    public String getDestination() {
        return destination;
    }

    public int getAttempts() {
        return attempts;
    }
}
