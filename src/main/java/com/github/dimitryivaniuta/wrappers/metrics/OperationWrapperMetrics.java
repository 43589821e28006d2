package com.github.dimitryivaniuta.wrappers.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public class OperationWrapperMetrics {

    private final MeterRegistry registry;

    public OperationWrapperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Cache ----
    public void cacheHit(String cacheName, String operationKey) {
        Counter.builder("operation_wrappers_cache_hits_total")
                .tag("cache", cacheName)
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    public void cacheMiss(String cacheName, String operationKey) {
        Counter.builder("operation_wrappers_cache_misses_total")
                .tag("cache", cacheName)
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    // ---- Retry ----
    public void retryAttempt(String operationKey) {
        Counter.builder("operation_wrappers_retry_attempts_total")
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    public void retryExhausted(String operationKey) {
        Counter.builder("operation_wrappers_retry_exhausted_total")
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    // ---- Timeout ----
    public void timedOut(String operationKey) {
        Counter.builder("operation_wrappers_timeouts_total")
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    // ---- Circuit breaker ----
    public void circuitTransition(String operationKey, String state) {
        Counter.builder("operation_wrappers_circuit_transitions_total")
                .tag("operation", operationKey)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void circuitRejected(String operationKey) {
        Counter.builder("operation_wrappers_circuit_rejected_total")
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    // ---- Rate limiting ----
    public void rateLimitRejected(String operationKey) {
        Counter.builder("operation_wrappers_ratelimit_rejected_total")
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    public void rateLimitAllowed(String operationKey) {
        Counter.builder("operation_wrappers_ratelimit_allowed_total")
                .tag("operation", operationKey)
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordDuration(String metricName, String operationKey, String outcome, long nanos) {
        Timer.builder(metricName)
                .tag("operation", operationKey)
                .tag("outcome", outcome)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
