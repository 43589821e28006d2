package com.github.dimitryivaniuta.wrappers.lifecycle;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a hook before the operation. If the hook is pending, the operation's result is released
 * only once the hook settles.
 */
public class EffectBeforeWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final EffectHook hook;

    public EffectBeforeWrapper(OperationDefinition definition, EffectHook hook) {
        this.definition = definition;
        this.hook = hook;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        EffectContext context = EffectContext.of(definition, args);

        if (definition.async()) {
            CompletableFuture<Object> before = Operations.invokeAsync(ignored -> hook.apply(context), args);
            CompletableFuture<Object> result = Operations.invokeAsync(next, args);
            return before.thenCompose(ignored -> result);
        }

        Object before = hook.apply(context);
        Object result = next.invoke(args);
        Operations.await(before);
        return result;
    }
}
