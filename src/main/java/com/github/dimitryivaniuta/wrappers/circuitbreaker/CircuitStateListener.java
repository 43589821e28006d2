package com.github.dimitryivaniuta.wrappers.circuitbreaker;

@FunctionalInterface
public interface CircuitStateListener {

    CircuitStateListener NONE = state -> { };

    void onStateChange(CircuitState newState);
}
