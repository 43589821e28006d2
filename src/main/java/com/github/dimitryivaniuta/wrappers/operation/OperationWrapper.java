package com.github.dimitryivaniuta.wrappers.operation;

/**
 * Behaviour attached around an {@link Operation}.
 *
 * <p>A wrapper instance owns the state it needs across invocations (cache keys, breaker state,
 * time windows). {@link #wrap(Operation)} only builds a thin decorator, so a chain can be
 * recomposed per call without losing that state.
 */
public interface OperationWrapper {

    /**
     * Runs one invocation, delegating to {@code next} zero or more times.
     */
    Object invoke(Object[] args, Operation next) throws Throwable;

    default Operation wrap(Operation next) {
        return args -> invoke(args, next);
    }
}
