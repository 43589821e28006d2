package com.github.dimitryivaniuta.wrappers.shaping;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Collapses a burst of calls into one trailing invocation with the last call's arguments.
 *
 * <p>ASYNC: every caller of the burst gets the same future, completed with the outcome of the one
 * invocation that runs. SYNC: callers get {@code null} at once; a failure of the trailing
 * invocation has nobody to go to and is logged.
 */
@Slf4j
public class DebounceWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final long delayMillis;
    private final ShapingVariant variant;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    private final Map<String, Pending> pending = new HashMap<>();

    public DebounceWrapper(OperationDefinition definition,
                           Duration delay,
                           ShapingVariant variant,
                           ScheduledExecutorService scheduler) {
        Assert.isTrue(delay != null && !delay.isNegative(), "delay must not be negative");
        this.definition = definition;
        this.delayMillis = delay.toMillis();
        this.variant = variant;
        this.scheduler = scheduler;
    }

    @Override
    public Object invoke(Object[] args, Operation next) {
        String key = definition.key();
        CompletableFuture<Object> result;

        synchronized (lock) {
            Pending previous = pending.get(key);
            if (previous != null) {
                previous.timer.cancel(false);
                result = previous.result;
            } else {
                result = new CompletableFuture<>();
            }

            Pending current = new Pending(result);
            pending.put(key, current);
            current.timer = scheduler.schedule(() -> fire(key, current, args, next), delayMillis, TimeUnit.MILLISECONDS);
        }

        return (variant == ShapingVariant.ASYNC) ? result : null;
    }

    private void fire(String key, Pending self, Object[] args, Operation next) {
        synchronized (lock) {
            // superseded after the timer had already started
            if (pending.get(key) != self) return;
            pending.remove(key);
        }

        Operations.relay(Operations.invokeAsync(next, args), self.result);

        if (variant == ShapingVariant.SYNC) {
            self.result.whenComplete((value, ex) -> {
                if (ex != null) log.warn("Debounced call {} failed: {}", key, ex.toString());
            });
        }
    }

    private static final class Pending {
        final CompletableFuture<Object> result;
        volatile ScheduledFuture<?> timer;

        Pending(CompletableFuture<Object> result) {
            this.result = result;
        }
    }
}
