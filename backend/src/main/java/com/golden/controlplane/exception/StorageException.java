package com.golden.controlplane.exception;

/**
 * Transient infrastructure failure. Safe to retry with the same request key.
 */
public class StorageException extends ControlPlaneException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
