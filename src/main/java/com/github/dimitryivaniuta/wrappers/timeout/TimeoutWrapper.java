package com.github.dimitryivaniuta.wrappers.timeout;

import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Races an operation against a deadline.
 *
 * <p>The underlying work is NOT cancelled when the deadline wins: it keeps running and its
 * eventual result or failure is discarded. Synchronous operations therefore run on
 * {@code workers} (thread-bound context such as MDC or transactions is not carried over) while
 * the caller waits at most {@code timeout}.
 */
public class TimeoutWrapper implements OperationWrapper {

    private final OperationDefinition definition;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final OperationWrapperMetrics metrics;

    public TimeoutWrapper(OperationDefinition definition,
                          Duration timeout,
                          ScheduledExecutorService scheduler,
                          ExecutorService workers,
                          OperationWrapperMetrics metrics) {
        Assert.isTrue(timeout != null && !timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        this.definition = definition;
        this.timeout = timeout;
        this.scheduler = scheduler;
        this.workers = workers;
        this.metrics = metrics;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        if (definition.async()) {
            return race(Operations.invokeAsync(next, args));
        }

        CompletableFuture<Object> underlying = CompletableFuture.supplyAsync(() -> {
            try {
                return next.invoke(args);
            } catch (Throwable ex) {
                throw new CompletionException(ex);
            }
        }, workers);

        try {
            return underlying.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw timedOut();
        } catch (ExecutionException ex) {
            throw Operations.unwrap(ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ex;
        }
    }

    private CompletableFuture<Object> race(CompletableFuture<Object> underlying) {
        CompletableFuture<Object> race = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> {
                    if (!race.isDone()) race.completeExceptionally(timedOut());
                },
                timeout.toMillis(), TimeUnit.MILLISECONDS);

        underlying.whenComplete((value, ex) -> {
            timer.cancel(false);
            if (ex != null) {
                race.completeExceptionally(Operations.unwrap(ex));
            } else {
                race.complete(value);
            }
        });
        return race;
    }

    private OperationTimeoutException timedOut() {
        metrics.timedOut(definition.key());
        return new OperationTimeoutException(definition.name(), timeout);
    }
}
