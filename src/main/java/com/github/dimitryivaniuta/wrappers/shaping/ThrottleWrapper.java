package com.github.dimitryivaniuta.wrappers.shaping;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;
import org.springframework.util.Assert;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs at most one call per {@code interval}; the first call of an interval wins.
 *
 * <p>Calls inside the interval do not run: SYNC returns {@code null}, ASYNC returns the future
 * recorded by the last call that ran (or a completed {@code null} future).
 */
public class ThrottleWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final long intervalMillis;
    private final ShapingVariant variant;
    private final Clock clock;

    private final Map<String, ThrottleState> states = new ConcurrentHashMap<>();

    public ThrottleWrapper(OperationDefinition definition, Duration interval, ShapingVariant variant, Clock clock) {
        Assert.isTrue(interval != null && !interval.isNegative(), "interval must not be negative");
        this.definition = definition;
        this.intervalMillis = interval.toMillis();
        this.variant = variant;
        this.clock = clock;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        String key = definition.key();
        CompletableFuture<Object> slot = (variant == ShapingVariant.ASYNC) ? new CompletableFuture<>() : null;

        boolean[] admitted = {false};
        ThrottleState state = states.compute(key, (k, previous) -> {
            long now = clock.millis();
            if (previous == null || now - previous.lastCallTime() >= intervalMillis) {
                admitted[0] = true;
                return new ThrottleState(now, slot);
            }
            return previous;
        });

        if (!admitted[0]) {
            if (variant == ShapingVariant.SYNC) return null;
            return (state.lastResult() != null) ? state.lastResult() : CompletableFuture.completedFuture(null);
        }

        if (variant == ShapingVariant.SYNC) return next.invoke(args);

        Operations.relay(Operations.invokeAsync(next, args), slot);
        return slot;
    }

    private record ThrottleState(long lastCallTime, CompletableFuture<Object> lastResult) {}
}
