package com.github.dimitryivaniuta.wrappers.proxy.annotations;

import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitStateListener;
import com.github.dimitryivaniuta.wrappers.proxy.StateScope;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface ProxyCircuitBreaker {

    int failureThreshold() default 5;

    long resetTimeoutMs() default 30_000;

    Class<? extends CircuitStateListener> listener() default CircuitStateListener.class;

    /**
     * DEFINITION shares one breaker between all beans of the class; INSTANCE gives each bean its own.
     */
    StateScope scope() default StateScope.DEFINITION;
}
