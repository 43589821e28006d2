package com.github.dimitryivaniuta.wrappers.shaping;

/**
 * How a debounced or throttled call answers its caller.
 */
public enum ShapingVariant {
    /** returns {@code null} straight away when the call does not run now */
    SYNC,
    /** returns a future */
    ASYNC
}
