package com.github.dimitryivaniuta.wrappers.proxy.annotations;

import com.github.dimitryivaniuta.wrappers.proxy.StateScope;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Sliding-window rate limiting at method level.
 *
 * <p>Semantics:
 * <ul>
 *   <li>{@code limit} calls are admitted per {@code windowMs} and key.</li>
 *   <li>{@code key} is an optional SpEL over the arguments; empty means one bucket per method.</li>
 *   <li>Rejected calls fail with RateLimitExceededException carrying the retry-after duration.</li>
 * </ul>
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface ProxyRateLimit {

    int limit();

    long windowMs();

    String key() default "";

    StateScope scope() default StateScope.DEFINITION;
}
