package com.github.dimitryivaniuta.wrappers.circuitbreaker;

import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;

import java.util.concurrent.CompletableFuture;

/**
 * Gates invocations through a {@link CircuitBreaker}. The breaker is passed in so several
 * wrappers (e.g. one per bean instance) can share a single state object.
 */
public class CircuitBreakerWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final CircuitBreaker breaker;
    private final OperationWrapperMetrics metrics;

    public CircuitBreakerWrapper(OperationDefinition definition,
                                 CircuitBreaker breaker,
                                 OperationWrapperMetrics metrics) {
        this.definition = definition;
        this.breaker = breaker;
        this.metrics = metrics;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        if (!breaker.tryAcquire()) {
            metrics.circuitRejected(definition.key());
            CircuitBreakerOpenException rejected = new CircuitBreakerOpenException(definition.name());
            if (definition.async()) return CompletableFuture.failedFuture(rejected);
            throw rejected;
        }

        if (definition.async()) {
            return Operations.invokeAsync(next, args).whenComplete((value, ex) -> {
                if (ex != null) breaker.recordFailure(); else breaker.recordSuccess();
            });
        }

        try {
            Object result = next.invoke(args);
            breaker.recordSuccess();
            return result;
        } catch (Throwable ex) {
            // bookkeeping only, the caller still sees the failure
            breaker.recordFailure();
            throw ex;
        }
    }

    public CircuitBreaker breaker() {
        return breaker;
    }
}
