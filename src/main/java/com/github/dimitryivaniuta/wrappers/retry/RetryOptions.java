package com.github.dimitryivaniuta.wrappers.retry;

import lombok.Builder;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * @param maxRetries retries after the first attempt (total attempts = maxRetries + 1)
 * @param strategy   NORMAL (constant) or EXPONENTIAL (doubling) waits
 * @param backoff    base delay, 1000ms when not set
 * @param onRetry    optional listener
 * @param retryOn    which failures are retried; every {@link Exception} when not set
 */
@Builder
public record RetryOptions(int maxRetries,
                           RetryStrategy strategy,
                           Duration backoff,
                           RetryListener onRetry,
                           Predicate<Throwable> retryOn) {

    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(1000);

    public RetryOptions {
        Assert.isTrue(maxRetries >= 0, "maxRetries must be >= 0");
        if (strategy == null) strategy = RetryStrategy.NORMAL;
        if (backoff == null) backoff = DEFAULT_BACKOFF;
        Assert.isTrue(!backoff.isNegative(), "backoff must not be negative");
        if (onRetry == null) onRetry = RetryListener.NONE;
        if (retryOn == null) retryOn = ex -> true;
    }
}
