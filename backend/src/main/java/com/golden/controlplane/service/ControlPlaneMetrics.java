package com.golden.controlplane.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class ControlPlaneMetrics {

    private final MeterRegistry meterRegistry;

    private Counter budgetCommitsCounter;
    private Counter budgetReleasesCounter;
    private Counter dlqParkedCounter;
    private Counter dlqResolvedCounter;
    private Counter workItemRetriesCounter;
    private Counter breakerResetsCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        budgetCommitsCounter = Counter.builder("budget_commits_total").register(meterRegistry);
        budgetReleasesCounter = Counter.builder("budget_releases_total").register(meterRegistry);
        dlqParkedCounter = Counter.builder("dlq_parked_total").register(meterRegistry);
        dlqResolvedCounter = Counter.builder("dlq_resolved_total").register(meterRegistry);
        workItemRetriesCounter = Counter.builder("work_item_retries_total").register(meterRegistry);
        breakerResetsCounter = Counter.builder("breaker_resets_total").register(meterRegistry);
    }

    public void recordBudgetRequest(String status) {
        meterRegistry.counter("budget_requests_total", "status", status).increment();
    }

    public void recordBudgetCommit() {
        increment(budgetCommitsCounter);
    }

    public void recordBudgetRelease() {
        increment(budgetReleasesCounter);
    }

    public void recordDeadLetterParked() {
        increment(dlqParkedCounter);
    }

    public void recordDeadLetterResolved() {
        increment(dlqResolvedCounter);
    }

    public void recordWorkItemRetry() {
        increment(workItemRetriesCounter);
    }

    public void recordBreakerReset() {
        increment(breakerResetsCounter);
    }

    public void recordBreakerRejection(String breaker) {
        meterRegistry.counter("breaker_rejections_total", "breaker", breaker).increment();
    }

    public void recordGovernanceDecision(String outcome) {
        meterRegistry.counter("governance_decisions_total", "outcome", outcome).increment();
    }

    public void recordAlert(String type) {
        meterRegistry.counter("critical_alerts_total", "type", type).increment();
    }

    public void registerBreakerGauge(String breaker, Supplier<Number> stateCode) {
        Gauge.builder("breaker_state", stateCode)
                .tag("breaker", breaker)
                .register(meterRegistry);
    }

    public void registerGauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value).register(meterRegistry);
    }

    private void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
