package com.github.dimitryivaniuta.wrappers.proxy;

/**
 * Who shares circuit-breaker and rate-limiter state for an annotated method.
 */
public enum StateScope {
    /** One state object per class and method, shared by every bean of that class. */
    DEFINITION,
    /** One state object per bean. */
    INSTANCE
}
