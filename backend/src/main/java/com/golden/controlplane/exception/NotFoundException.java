package com.golden.controlplane.exception;

public class NotFoundException extends ControlPlaneException {
    public NotFoundException(String message) {
        super(message);
    }
}
