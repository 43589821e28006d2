package com.github.dimitryivaniuta.wrappers.guard;

/**
 * Decides whether a call may proceed. Async guards return a
 * {@code CompletionStage<Boolean>}; sync guards return a {@code Boolean}.
 */
@FunctionalInterface
public interface GuardPredicate {

    Object test(Object[] args) throws Throwable;
}
