package com.github.dimitryivaniuta.wrappers.proxy.annotations;

import com.github.dimitryivaniuta.wrappers.retry.RetryListener;
import com.github.dimitryivaniuta.wrappers.retry.RetryStrategy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables retry around a method via the operation-wrappers proxy.
 *
 * Recommendations:
 * - Apply ONLY to operations that are safe to retry (idempotent calls).
 * - Keep maxRetries low for request/response paths.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface ProxyRetry {

    /**
     * Retries after the initial call (total attempts = maxRetries + 1).
     */
    int maxRetries() default 3;

    RetryStrategy strategy() default RetryStrategy.NORMAL;

    /**
     * Base backoff in milliseconds; doubled per attempt for EXPONENTIAL.
     */
    long backoffMs() default 1000;

    /**
     * Notified before every wait. Resolved as a bean when one exists, otherwise instantiated.
     */
    Class<? extends RetryListener> listener() default RetryListener.class;

    /**
     * Only these exception types are retried.
     */
    Class<? extends Throwable>[] retryOn() default { Exception.class };

    /**
     * Explicit deny-list; if matched, never retry even if retryOn matches.
     */
    Class<? extends Throwable>[] ignoreOn() default {};
}
