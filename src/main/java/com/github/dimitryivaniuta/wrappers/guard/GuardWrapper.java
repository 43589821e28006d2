package com.github.dimitryivaniuta.wrappers.guard;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;

import java.util.concurrent.CompletableFuture;

public class GuardWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final GuardPredicate guard;

    public GuardWrapper(OperationDefinition definition, GuardPredicate guard) {
        this.definition = definition;
        this.guard = guard;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        if (definition.async()) {
            return Operations.invokeAsync(ignored -> guard.test(args), args).thenCompose(allowed -> {
                if (!Boolean.TRUE.equals(allowed)) {
                    return CompletableFuture.<Object>failedFuture(new GuardRejectedException(definition.name()));
                }
                return Operations.invokeAsync(next, args);
            });
        }

        if (!Boolean.TRUE.equals(Operations.await(guard.test(args)))) {
            throw new GuardRejectedException(definition.name());
        }
        return next.invoke(args);
    }
}
