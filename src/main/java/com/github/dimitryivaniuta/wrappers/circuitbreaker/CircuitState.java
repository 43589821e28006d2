package com.github.dimitryivaniuta.wrappers.circuitbreaker;

/**
 * <pre>
 * CLOSED --(failures reach threshold)--> OPEN
 * OPEN --(resetTimeout elapsed, next call)--> HALF_OPEN
 * HALF_OPEN --(trial succeeds)--> CLOSED
 * HALF_OPEN --(trial fails)--> OPEN
 * </pre>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
