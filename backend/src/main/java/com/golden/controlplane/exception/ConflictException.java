package com.golden.controlplane.exception;

public class ConflictException extends ControlPlaneException {
    public ConflictException(String message) {
        super(message);
    }
}
