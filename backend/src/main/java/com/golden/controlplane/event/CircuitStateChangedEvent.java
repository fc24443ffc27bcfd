package com.golden.controlplane.event;

import com.golden.controlplane.service.breaker.CircuitState;

import java.time.Instant;

public record CircuitStateChangedEvent(String breaker, CircuitState from, CircuitState to, boolean critical, Instant occurredAt) {}
