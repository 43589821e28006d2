package com.github.dimitryivaniuta.wrappers.proxy;

import com.github.dimitryivaniuta.wrappers.proxy.annotations.*;
import org.springframework.core.annotation.AnnotatedElementUtils;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.util.List;

public final class OperationWrappersSupport {
    private OperationWrappersSupport() {
    }

    static final List<Class<? extends Annotation>> WRAPPER_ANNOTATIONS = List.of(
            ProxyTimed.class,
            ProxyMeasure.class,
            ProxyDeprecate.class,
            ProxyGuard.class,
            ProxyEffectError.class,
            ProxyEffectAfter.class,
            ProxyEffectBefore.class,
            ProxyFallback.class,
            ProxyCache.class,
            ProxyMemoize.class,
            ProxyDebounce.class,
            ProxyThrottle.class,
            ProxyRetry.class,
            ProxyCircuitBreaker.class,
            ProxyRateLimit.class,
            ProxyTimeout.class
    );

    public static boolean hasAnyWrapperAnnotation(AnnotatedElement el) {
        for (Class<? extends Annotation> type : WRAPPER_ANNOTATIONS) {
            if (AnnotatedElementUtils.hasAnnotation(el, type)) return true;
        }
        return false;
    }

    /**
     * Method-level annotation wins over the type-level one.
     */
    public static <A extends Annotation> A find(Class<?> cls, Method m, Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(m, type);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(cls, type);
    }
}
