package com.github.dimitryivaniuta.wrappers.guard;

import com.github.dimitryivaniuta.wrappers.operation.OperationWrapperException;

public class GuardRejectedException extends OperationWrapperException {

    public GuardRejectedException(String operationName) {
        super(Kind.GUARD_REJECTED, operationName, "Guard failed for " + operationName);
    }
}
