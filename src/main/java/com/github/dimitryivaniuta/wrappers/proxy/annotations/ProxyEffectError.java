package com.github.dimitryivaniuta.wrappers.proxy.annotations;

import com.github.dimitryivaniuta.wrappers.lifecycle.EffectHook;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the hook when the call fails; the original error is always rethrown.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface ProxyEffectError {

    Class<? extends EffectHook> value();
}
