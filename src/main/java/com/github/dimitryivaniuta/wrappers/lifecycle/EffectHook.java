package com.github.dimitryivaniuta.wrappers.lifecycle;

/**
 * Lifecycle callback. Returning a {@link java.util.concurrent.CompletionStage} makes the wrapper
 * wait for it; any value it produces is ignored.
 */
@FunctionalInterface
public interface EffectHook {

    Object apply(EffectContext context) throws Throwable;
}
