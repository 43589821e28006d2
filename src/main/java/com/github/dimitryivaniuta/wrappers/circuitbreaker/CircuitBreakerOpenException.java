package com.github.dimitryivaniuta.wrappers.circuitbreaker;

import com.github.dimitryivaniuta.wrappers.operation.OperationWrapperException;

public class CircuitBreakerOpenException extends OperationWrapperException {

    public CircuitBreakerOpenException(String operationName) {
        super(Kind.CIRCUIT_OPEN, operationName, "Circuit breaker is open for " + operationName);
    }
}
