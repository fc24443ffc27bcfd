package com.golden.controlplane.service.breaker;

public enum CircuitState {
    CLOSED(0),
    HALF_OPEN(1),
    OPEN(2);

    private final int code;

    CircuitState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
