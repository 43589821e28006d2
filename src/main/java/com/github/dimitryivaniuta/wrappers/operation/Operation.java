package com.github.dimitryivaniuta.wrappers.operation;

/**
 * A unit of work that can be wrapped.
 *
 * <p>Synchronous operations return the value itself. Asynchronous operations return a
 * {@link java.util.concurrent.CompletionStage}; wrappers around them always hand back a
 * {@link java.util.concurrent.CompletableFuture}.
 */
@FunctionalInterface
public interface Operation {

    Object invoke(Object... args) throws Throwable;

    default Operation with(OperationWrapper wrapper) {
        return wrapper.wrap(this);
    }
}
