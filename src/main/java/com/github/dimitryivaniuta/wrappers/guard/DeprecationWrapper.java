package com.github.dimitryivaniuta.wrappers.guard;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Warns on every call of a deprecated operation, then delegates unchanged.
 */
@Slf4j
public class DeprecationWrapper implements OperationWrapper {

    private final String message;

    public DeprecationWrapper(OperationDefinition definition, String message) {
        this.message = (message == null || message.isBlank()) ? definition.name() + " is deprecated" : message;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        log.warn("Deprecation warning: {}", message);
        return next.invoke(args);
    }

    public String message() {
        return message;
    }
}
