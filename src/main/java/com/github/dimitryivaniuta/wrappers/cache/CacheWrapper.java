package com.github.dimitryivaniuta.wrappers.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.operation.KeyFunction;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;
import org.springframework.cache.Cache;

import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Result cache around one operation definition.
 *
 * <p>Entries live in a shared {@link Cache}; this wrapper remembers every key it produced so
 * {@link #invalidate()} clears only its own entries.
 */
public class CacheWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final Cache cache;
    private final KeyFunction keyFunction;
    private final ObjectMapper mapper;
    private final OperationWrapperMetrics metrics;

    private final Set<Object> producedKeys = ConcurrentHashMap.newKeySet();

    public CacheWrapper(OperationDefinition definition,
                        Cache cache,
                        KeyFunction keyFunction,
                        ObjectMapper mapper,
                        OperationWrapperMetrics metrics) {
        this.definition = definition;
        this.cache = cache;
        this.keyFunction = keyFunction;
        this.mapper = mapper;
        this.metrics = metrics;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        Object key = cacheKey(args);
        producedKeys.add(key);

        Cache.ValueWrapper hit = cache.get(key);
        if (hit != null) {
            metrics.cacheHit(cache.getName(), definition.key());
            return definition.async() ? CompletableFuture.completedFuture(hit.get()) : hit.get();
        }

        metrics.cacheMiss(cache.getName(), definition.key());
        Object result = next.invoke(args);

        if (Operations.isPending(result)) {
            // store only once resolved; failures propagate uncached
            return Operations.toFuture(result).thenApply(value -> {
                cache.put(key, value);
                return value;
            });
        }

        cache.put(key, result);
        return result;
    }

    /**
     * Removes every entry this wrapper has produced, leaving other operations' entries alone.
     */
    public void invalidate() {
        for (Object key : producedKeys) {
            cache.evict(key);
        }
        producedKeys.clear();
    }

    public OperationDefinition definition() {
        return definition;
    }

    private Object cacheKey(Object[] args) {
        String argsKey = (keyFunction != null) ? keyFunction.apply(args) : serialize(args);
        return new CacheKey(definition.key(), argsKey);
    }

    private String serialize(Object[] args) {
        try {
            return mapper.writeValueAsString(args);
        } catch (JsonProcessingException ex) {
            return Arrays.deepToString(args);
        }
    }

    public record CacheKey(String operationKey, String argsKey) {}
}
