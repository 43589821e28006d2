package com.github.dimitryivaniuta.wrappers.retry;

/**
 * Called before each wait, with the failure that triggered it and the number of attempts made so far.
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (error, attempt) -> { };

    void onRetry(Throwable error, int attempt);
}
