package com.github.dimitryivaniuta.wrappers.proxy.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Caches results of a method via the operation-wrappers proxy.
 *
 * Typical usage:
 * <pre>
 *   @ProxyCache(expiryMs = 30_000, key = "#customerId")
 *   public CustomerView view(Long customerId) { ... }
 * </pre>
 *
 * Notes:
 * - Entries are invalidated through {@code CachedOperations#invalidate(type, methodName)}.
 * - For CompletionStage methods only successful results are stored.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface ProxyCache {

    /**
     * Entry lifetime in milliseconds. 0 means entries never expire.
     */
    long expiryMs() default 0;

    /**
     * Optional SpEL key over the arguments (#p0, #a0, parameter names, #args).
     * Empty means scope + method name + serialized arguments.
     */
    String key() default "";
}
