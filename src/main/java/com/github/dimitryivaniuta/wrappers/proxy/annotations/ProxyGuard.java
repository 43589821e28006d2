package com.github.dimitryivaniuta.wrappers.proxy.annotations;

import com.github.dimitryivaniuta.wrappers.guard.GuardPredicate;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Rejects the call with GuardRejectedException unless the predicate answers true.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface ProxyGuard {

    Class<? extends GuardPredicate> value();
}
