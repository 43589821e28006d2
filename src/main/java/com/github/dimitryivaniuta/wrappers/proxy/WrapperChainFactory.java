package com.github.dimitryivaniuta.wrappers.proxy;

import com.github.dimitryivaniuta.wrappers.OperationWrappers;
import com.github.dimitryivaniuta.wrappers.cache.CacheOptions;
import com.github.dimitryivaniuta.wrappers.cache.CacheWrapper;
import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitBreaker;
import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitBreakerOptions;
import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitStateListener;
import com.github.dimitryivaniuta.wrappers.operation.KeyFunction;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.proxy.annotations.*;
import com.github.dimitryivaniuta.wrappers.ratelimit.RateLimitOptions;
import com.github.dimitryivaniuta.wrappers.ratelimit.SlidingWindowRateLimiter;
import com.github.dimitryivaniuta.wrappers.retry.RetryListener;
import com.github.dimitryivaniuta.wrappers.retry.RetryOptions;
import com.github.dimitryivaniuta.wrappers.timing.MeasureOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.util.ReflectionUtils;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static com.github.dimitryivaniuta.wrappers.proxy.OperationWrappersSupport.find;

/**
 * Turns the wrapper annotations of one method into an ordered wrapper list.
 *
 * <p>Order (outer -> inner):
 * <ol>
 *   <li>Timed / Measure: time everything, including short-circuits</li>
 *   <li>Deprecate, Guard</li>
 *   <li>EffectError, EffectAfter, EffectBefore: hooks see the final outcome</li>
 *   <li>Fallback: replaces any failure from below</li>
 *   <li>Debounce / Throttle: a skipped call never reaches the cache, so its placeholder is not stored</li>
 *   <li>Cache / Memoize: short-circuit before any backend work</li>
 *   <li>Retry: retries the protected execution only</li>
 *   <li>CircuitBreaker, RateLimit: every retry attempt counts</li>
 *   <li>Timeout: bounds a single attempt</li>
 * </ol>
 *
 * <p>Cache, debounce and throttle state is shared per class and method. Breaker and limiter state
 * follows the annotation's {@link StateScope}.
 */
@Slf4j
@RequiredArgsConstructor
public class WrapperChainFactory {

    private final OperationWrappers wrappers;
    private final BeanFactory beanFactory;
    private final CachedOperations cachedOperations;

    private final Map<StateKey, Object> definitionState = new ConcurrentHashMap<>();

    /**
     * @param target      the bean instance (used by fallback methods)
     * @param targetClass user class of the bean
     * @param method      most specific method on {@code targetClass}
     */
    public List<OperationWrapper> wrappersFor(Object target, Class<?> targetClass, Method method) {
        OperationDefinition def = OperationDefinition.of(targetClass, method);
        List<OperationWrapper> chain = new ArrayList<>();

        if (find(targetClass, method, ProxyTimed.class) != null) {
            chain.add(wrappers.timed(def));
        }
        ProxyMeasure measure = find(targetClass, method, ProxyMeasure.class);
        if (measure != null) {
            chain.add(wrappers.measure(def, MeasureOptions.builder().memory(measure.memory()).build()));
        }

        ProxyDeprecate deprecate = find(targetClass, method, ProxyDeprecate.class);
        if (deprecate != null) {
            chain.add(wrappers.deprecate(def, deprecate.message()));
        }
        ProxyGuard guard = find(targetClass, method, ProxyGuard.class);
        if (guard != null) {
            chain.add(wrappers.guard(def, resolve(guard.value())));
        }

        ProxyEffectError onError = find(targetClass, method, ProxyEffectError.class);
        if (onError != null) {
            chain.add(wrappers.effectError(def, resolve(onError.value())));
        }
        ProxyEffectAfter after = find(targetClass, method, ProxyEffectAfter.class);
        if (after != null) {
            chain.add(wrappers.effectAfter(def, resolve(after.value())));
        }
        ProxyEffectBefore before = find(targetClass, method, ProxyEffectBefore.class);
        if (before != null) {
            chain.add(wrappers.effectBefore(def, resolve(before.value())));
        }

        ProxyFallback fallback = find(targetClass, method, ProxyFallback.class);
        if (fallback != null) {
            chain.add(wrappers.fallback(def, fallbackOperation(target, targetClass, method, fallback.method())));
        }

        ProxyDebounce debounce = find(targetClass, method, ProxyDebounce.class);
        if (debounce != null) {
            requireNullableResult(method, "@ProxyDebounce");
            Duration delay = Duration.ofMillis(debounce.delayMs());
            chain.add(shared(targetClass, method, ProxyDebounce.class, () -> def.async()
                    ? wrappers.debounceAsync(def, delay)
                    : wrappers.debounceSync(def, delay)));
        }
        ProxyThrottle throttle = find(targetClass, method, ProxyThrottle.class);
        if (throttle != null) {
            requireNullableResult(method, "@ProxyThrottle");
            Duration interval = Duration.ofMillis(throttle.intervalMs());
            chain.add(shared(targetClass, method, ProxyThrottle.class, () -> def.async()
                    ? wrappers.throttleAsync(def, interval)
                    : wrappers.throttleSync(def, interval)));
        }

        ProxyCache cache = find(targetClass, method, ProxyCache.class);
        if (cache != null) {
            CacheWrapper cw = shared(targetClass, method, ProxyCache.class, () -> {
                CacheOptions options = CacheOptions.builder()
                        .expiryTime(cache.expiryMs() > 0 ? Duration.ofMillis(cache.expiryMs()) : null)
                        .key(keyFunction(cache.key(), method))
                        .build();
                CacheWrapper created = wrappers.cached(def, options);
                cachedOperations.register(targetClass, method.getName(), created);
                return created;
            });
            chain.add(cw);
        }
        if (find(targetClass, method, ProxyMemoize.class) != null) {
            chain.add(shared(targetClass, method, ProxyMemoize.class, () -> wrappers.memoize(def)));
        }

        ProxyRetry retry = find(targetClass, method, ProxyRetry.class);
        if (retry != null) {
            chain.add(wrappers.retry(def, RetryOptions.builder()
                    .maxRetries(retry.maxRetries())
                    .strategy(retry.strategy())
                    .backoff(Duration.ofMillis(retry.backoffMs()))
                    .onRetry(resolveOr(retry.listener(), RetryListener.class, RetryListener.NONE))
                    .retryOn(ex -> matches(retry.retryOn(), ex) && !matches(retry.ignoreOn(), ex))
                    .build()));
        }

        ProxyCircuitBreaker breaker = find(targetClass, method, ProxyCircuitBreaker.class);
        if (breaker != null) {
            Supplier<CircuitBreaker> state = () -> wrappers.circuitBreakerState(def, CircuitBreakerOptions.builder()
                    .failureThreshold(breaker.failureThreshold())
                    .resetTimeout(Duration.ofMillis(breaker.resetTimeoutMs()))
                    .onStateChange(resolveOr(breaker.listener(), CircuitStateListener.class, CircuitStateListener.NONE))
                    .build());
            CircuitBreaker cb = (breaker.scope() == StateScope.INSTANCE)
                    ? state.get()
                    : shared(targetClass, method, ProxyCircuitBreaker.class, state);
            chain.add(wrappers.circuitBreaker(def, cb));
        }

        ProxyRateLimit rateLimit = find(targetClass, method, ProxyRateLimit.class);
        if (rateLimit != null) {
            RateLimitOptions options = RateLimitOptions.builder()
                    .limit(rateLimit.limit())
                    .window(Duration.ofMillis(rateLimit.windowMs()))
                    .key(rateLimit.key().isBlank() ? null : keyFunction(rateLimit.key(), method))
                    .build();
            SlidingWindowRateLimiter limiter = (rateLimit.scope() == StateScope.INSTANCE)
                    ? wrappers.rateLimiterState(options)
                    : shared(targetClass, method, ProxyRateLimit.class, () -> wrappers.rateLimiterState(options));
            chain.add(wrappers.rateLimited(def, options, limiter));
        }

        ProxyTimeout timeout = find(targetClass, method, ProxyTimeout.class);
        if (timeout != null) {
            chain.add(wrappers.timeout(def, Duration.ofMillis(timeout.ms())));
        }

        log.debug("Wrapper chain for {}: {}", def.key(), chain.stream().map(w -> w.getClass().getSimpleName()).toList());
        return List.copyOf(chain);
    }

    @SuppressWarnings("unchecked")
    private <T> T shared(Class<?> targetClass, Method method, Class<? extends Annotation> type, Supplier<T> factory) {
        return (T) definitionState.computeIfAbsent(new StateKey(targetClass, method, type), k -> factory.get());
    }

    private <T> T resolve(Class<T> type) {
        return beanFactory.getBeanProvider(type).getIfAvailable(() -> BeanUtils.instantiateClass(type));
    }

    /**
     * Annotation attributes default to the interface itself, meaning "no listener".
     */
    private <T> T resolveOr(Class<? extends T> type, Class<T> none, T noneValue) {
        return (type == none) ? noneValue : resolve(type);
    }

    private static KeyFunction keyFunction(String expression, Method method) {
        return (expression == null || expression.isBlank()) ? null : new SpelKeyFunction(expression, method);
    }

    private static boolean matches(Class<? extends Throwable>[] types, Throwable ex) {
        for (Class<? extends Throwable> t : types) {
            if (t.isInstance(ex)) return true;
        }
        return false;
    }

    private static void requireNullableResult(Method method, String annotation) {
        Class<?> rt = method.getReturnType();
        if (rt.isPrimitive() && rt != void.class) {
            throw new IllegalStateException(annotation + " may skip calls and needs a nullable return type: " + method);
        }
    }

    private static Operation fallbackOperation(Object target, Class<?> targetClass, Method method, String name) {
        Method fallback = ReflectionUtils.findMethod(targetClass, name, method.getParameterTypes());
        if (fallback == null) {
            throw new IllegalStateException("Fallback method " + name + " not found on " + targetClass.getName()
                    + " with parameters of " + method);
        }
        ReflectionUtils.makeAccessible(fallback);
        return args -> {
            try {
                return fallback.invoke(target, args);
            } catch (InvocationTargetException ex) {
                throw ex.getTargetException();
            }
        };
    }

    private record StateKey(Class<?> targetClass, Method method, Class<? extends Annotation> type) {}
}
