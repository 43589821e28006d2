package com.github.dimitryivaniuta.wrappers.proxy;

import com.github.dimitryivaniuta.wrappers.cache.CacheWrapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Invalidation surface for {@code @ProxyCache} methods.
 *
 * <p>{@code invalidate(CustomerService.class, "view")} drops every entry produced by
 * {@code view(..)} (all overloads) and nothing else.
 */
@Slf4j
public class CachedOperations {

    private final Map<Class<?>, Map<String, List<CacheWrapper>>> registry = new ConcurrentHashMap<>();

    void register(Class<?> targetClass, String methodName, CacheWrapper wrapper) {
        registry.computeIfAbsent(targetClass, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(methodName, k -> new CopyOnWriteArrayList<>())
                .add(wrapper);
    }

    /**
     * @param type       the bean class or any supertype of it
     * @param methodName cached method
     * @return number of cached operations that were invalidated
     */
    public int invalidate(Class<?> type, String methodName) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(methodName, "methodName must not be null");

        int count = 0;
        for (var entry : registry.entrySet()) {
            if (!type.isAssignableFrom(entry.getKey())) continue;
            for (CacheWrapper wrapper : entry.getValue().getOrDefault(methodName, List.of())) {
                wrapper.invalidate();
                count++;
            }
        }
        log.debug("Invalidated {} cached operation(s) for {}#{}", count, type.getSimpleName(), methodName);
        return count;
    }
}
