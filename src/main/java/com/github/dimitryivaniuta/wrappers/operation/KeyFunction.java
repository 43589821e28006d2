package com.github.dimitryivaniuta.wrappers.operation;

/**
 * Derives a state key (cache entry, rate-limit bucket) from call arguments.
 */
@FunctionalInterface
public interface KeyFunction {

    String apply(Object[] args);

    static KeyFunction constant(String key) {
        return args -> key;
    }
}
