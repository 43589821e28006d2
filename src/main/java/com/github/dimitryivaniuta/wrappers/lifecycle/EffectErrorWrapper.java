package com.github.dimitryivaniuta.wrappers.lifecycle;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a hook when the operation fails, then rethrows the original error. A failing hook never
 * replaces that error; it is attached to it as suppressed.
 */
public class EffectErrorWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final EffectHook hook;

    public EffectErrorWrapper(OperationDefinition definition, EffectHook hook) {
        this.definition = definition;
        this.hook = hook;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        if (definition.async()) {
            return Operations.invokeAsync(next, args).exceptionallyCompose(ex -> {
                Throwable error = Operations.unwrap(ex);
                EffectContext context = EffectContext.of(definition, args).withError(error);
                return Operations.invokeAsync(ignored -> hook.apply(context), args)
                        .handle((ignored, hookError) -> {
                            if (hookError != null) suppress(error, Operations.unwrap(hookError));
                            return error;
                        })
                        .thenCompose(CompletableFuture::<Object>failedFuture);
            });
        }

        try {
            return next.invoke(args);
        } catch (Exception ex) {
            try {
                Operations.await(hook.apply(EffectContext.of(definition, args).withError(ex)));
            } catch (Throwable hookError) {
                suppress(ex, hookError);
            }
            throw ex;
        }
    }

    private static void suppress(Throwable error, Throwable hookError) {
        if (hookError != error) error.addSuppressed(hookError);
    }
}
