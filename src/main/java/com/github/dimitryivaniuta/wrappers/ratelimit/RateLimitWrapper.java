package com.github.dimitryivaniuta.wrappers.ratelimit;

import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.operation.KeyFunction;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

public class RateLimitWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final SlidingWindowRateLimiter limiter;
    private final KeyFunction keyFunction;
    private final OperationWrapperMetrics metrics;

    public RateLimitWrapper(OperationDefinition definition,
                            SlidingWindowRateLimiter limiter,
                            KeyFunction keyFunction,
                            OperationWrapperMetrics metrics) {
        this.definition = definition;
        this.limiter = limiter;
        this.keyFunction = keyFunction;
        this.metrics = metrics;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        String key = (keyFunction != null) ? keyFunction.apply(args) : definition.key();

        Duration retryAfter = limiter.tryAcquire(key);
        if (!retryAfter.isZero()) {
            metrics.rateLimitRejected(definition.key());
            RateLimitExceededException rejected = new RateLimitExceededException(definition.name(), retryAfter);
            if (definition.async()) return CompletableFuture.failedFuture(rejected);
            throw rejected;
        }

        metrics.rateLimitAllowed(definition.key());
        return next.invoke(args);
    }

    public SlidingWindowRateLimiter limiter() {
        return limiter;
    }
}
