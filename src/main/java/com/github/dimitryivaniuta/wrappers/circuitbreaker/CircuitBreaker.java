package com.github.dimitryivaniuta.wrappers.circuitbreaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Three-state breaker shared by every caller of one operation definition.
 *
 * <p>All reads and transitions happen under the instance lock. The state listener runs inside
 * that lock, once per actual transition.
 */
@Slf4j
public final class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutMillis;
    private final CircuitStateListener listener;
    private final Clock clock;

    private int failures;
    private CircuitState state = CircuitState.CLOSED;
    private long lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerOptions options, Clock clock) {
        this.name = name;
        this.failureThreshold = options.failureThreshold();
        this.resetTimeoutMillis = options.resetTimeout().toMillis();
        this.listener = options.onStateChange();
        this.clock = clock;
    }

    /**
     * @return true if the call may invoke the operation
     */
    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.millis() - lastFailureTime < resetTimeoutMillis) return false;
                transition(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return true;
            case HALF_OPEN:
            default:
                // exactly one trial call while half-open
                if (trialInFlight) return false;
                trialInFlight = true;
                return true;
        }
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            failures = 0;
            transition(CircuitState.CLOSED);
        }
    }

    public synchronized void recordFailure() {
        failures++;
        lastFailureTime = clock.millis();

        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            transition(CircuitState.OPEN);
        } else if (failures >= failureThreshold) {
            transition(CircuitState.OPEN);
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailures() {
        return failures;
    }

    public String getName() {
        return name;
    }

    private void transition(CircuitState newState) {
        if (state == newState) return;
        log.debug("Circuit breaker {} {} -> {}", name, state, newState);
        state = newState;
        listener.onStateChange(newState);
    }
}
