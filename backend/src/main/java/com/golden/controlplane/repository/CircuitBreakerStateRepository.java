package com.golden.controlplane.repository;

import com.golden.controlplane.model.CircuitBreakerState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CircuitBreakerStateRepository extends JpaRepository<CircuitBreakerState, String> {}
