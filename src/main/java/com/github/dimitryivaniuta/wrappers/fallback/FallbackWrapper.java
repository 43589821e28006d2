package com.github.dimitryivaniuta.wrappers.fallback;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Substitutes the outcome of {@code fallback} (called with the same arguments) when the operation
 * fails. The original error is dropped. On success the fallback is never touched.
 */
@Slf4j
public class FallbackWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final Operation fallback;

    public FallbackWrapper(OperationDefinition definition, Operation fallback) {
        this.definition = definition;
        this.fallback = fallback;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        if (definition.async()) {
            return Operations.invokeAsync(next, args).exceptionallyCompose(ex -> {
                Throwable cause = Operations.unwrap(ex);
                if (!(cause instanceof Exception)) return CompletableFuture.<Object>failedFuture(cause);
                log.debug("{} failed, using fallback: {}", definition.key(), cause.toString());
                return Operations.invokeAsync(fallback, args);
            });
        }

        try {
            return next.invoke(args);
        } catch (Exception ex) {
            log.debug("{} failed, using fallback: {}", definition.key(), ex.toString());
            return fallback.invoke(args);
        }
    }
}
