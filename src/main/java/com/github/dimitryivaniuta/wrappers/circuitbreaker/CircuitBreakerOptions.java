package com.github.dimitryivaniuta.wrappers.circuitbreaker;

import lombok.Builder;
import org.springframework.util.Assert;

import java.time.Duration;

@Builder
public record CircuitBreakerOptions(int failureThreshold,
                                    Duration resetTimeout,
                                    CircuitStateListener onStateChange) {

    public CircuitBreakerOptions {
        Assert.isTrue(failureThreshold >= 1, "failureThreshold must be >= 1");
        Assert.notNull(resetTimeout, "resetTimeout must not be null");
        Assert.isTrue(!resetTimeout.isNegative(), "resetTimeout must not be negative");
        if (onStateChange == null) onStateChange = CircuitStateListener.NONE;
    }
}
