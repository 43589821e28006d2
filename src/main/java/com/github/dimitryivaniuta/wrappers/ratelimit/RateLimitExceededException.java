package com.github.dimitryivaniuta.wrappers.ratelimit;

import com.github.dimitryivaniuta.wrappers.operation.OperationWrapperException;
import lombok.Getter;

import java.time.Duration;

@Getter
public class RateLimitExceededException extends OperationWrapperException {

    private final Duration retryAfter;

    public RateLimitExceededException(String operationName, Duration retryAfter) {
        super(Kind.RATE_LIMITED, operationName,
                "Rate limit exceeded for " + operationName + ". Try again in "
                        + retryAfterSeconds(retryAfter) + " seconds.");
        this.retryAfter = retryAfter;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds(retryAfter);
    }

    private static long retryAfterSeconds(Duration retryAfter) {
        long millis = Math.max(0, retryAfter.toMillis());
        return (millis + 999) / 1000;
    }
}
