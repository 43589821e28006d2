package com.github.dimitryivaniuta.wrappers.lifecycle;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;

/**
 * Runs a hook after a successful result. The hook sees the result but cannot change it.
 */
public class EffectAfterWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final EffectHook hook;

    public EffectAfterWrapper(OperationDefinition definition, EffectHook hook) {
        this.definition = definition;
        this.hook = hook;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        if (definition.async()) {
            return Operations.invokeAsync(next, args).thenCompose(value -> {
                EffectContext context = EffectContext.of(definition, args).withResult(value);
                return Operations.invokeAsync(ignored -> hook.apply(context), args).thenApply(ignored -> value);
            });
        }

        Object result = next.invoke(args);
        Operations.await(hook.apply(EffectContext.of(definition, args).withResult(result)));
        return result;
    }
}
