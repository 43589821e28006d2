package com.github.dimitryivaniuta.wrappers.timeout;

import com.github.dimitryivaniuta.wrappers.operation.OperationWrapperException;
import lombok.Getter;

import java.time.Duration;

@Getter
public class OperationTimeoutException extends OperationWrapperException {

    private final Duration timeout;

    public OperationTimeoutException(String operationName, Duration timeout) {
        super(Kind.TIMEOUT, operationName, operationName + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }
}
