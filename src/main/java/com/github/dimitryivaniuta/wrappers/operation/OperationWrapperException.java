package com.github.dimitryivaniuta.wrappers.operation;

import lombok.Getter;

/**
 * Base type of every failure a wrapper synthesizes itself.
 * Failures of the wrapped operation are never converted into this type.
 */
@Getter
public abstract class OperationWrapperException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        CIRCUIT_OPEN,
        RATE_LIMITED,
        GUARD_REJECTED
    }

    private final Kind kind;
    private final String operationName;

    protected OperationWrapperException(Kind kind, String operationName, String message) {
        super(message);
        this.kind = kind;
        this.operationName = operationName;
    }
}
