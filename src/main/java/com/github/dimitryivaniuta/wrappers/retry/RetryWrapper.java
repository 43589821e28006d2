package com.github.dimitryivaniuta.wrappers.retry;

import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Re-invokes a failing operation within a bounded attempt budget.
 *
 * <p>Attempts of one call always run one after another. Synchronous operations wait on the
 * calling thread; asynchronous ones wait on the scheduler. The error surfaced after the last
 * attempt is the operation's own.
 */
@Slf4j
public class RetryWrapper implements OperationWrapper {

    // resilience4j treats a zero async delay as "stop retrying"
    private static final long MIN_DELAY_MILLIS = 1;

    private final OperationDefinition definition;
    private final ScheduledExecutorService scheduler;
    private final OperationWrapperMetrics metrics;
    private final Retry retry;

    public RetryWrapper(OperationDefinition definition,
                        RetryOptions options,
                        ScheduledExecutorService scheduler,
                        OperationWrapperMetrics metrics) {
        this.definition = definition;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.retry = buildRetry(definition, options);
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        String key = definition.key();

        if (definition.async()) {
            CompletableFuture<Object> result = Retry.decorateCompletionStage(retry, scheduler, () -> {
                metrics.retryAttempt(key);
                return Operations.invokeAsync(next, args);
            }).get().toCompletableFuture();
            return result.whenComplete((value, ex) -> {
                if (ex != null) metrics.retryExhausted(key);
            });
        }

        try {
            return Retry.decorateCheckedSupplier(retry, () -> {
                metrics.retryAttempt(key);
                return next.invoke(args);
            }).get();
        } catch (Throwable ex) {
            metrics.retryExhausted(key);
            throw ex;
        }
    }

    private static Retry buildRetry(OperationDefinition definition, RetryOptions options) {
        long backoffMillis = options.backoff().toMillis();
        RetryStrategy strategy = options.strategy();
        IntervalFunction interval = attempt ->
                Math.max(MIN_DELAY_MILLIS, strategy.delayMillis(backoffMillis, attempt));

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(options.maxRetries() + 1)
                .intervalFunction(interval)
                .retryOnException(ex -> options.retryOn().test(Operations.unwrap(ex)))
                .failAfterMaxAttempts(false)
                .build();

        Retry retry = Retry.of("retry:" + definition.key(), config);
        RetryListener listener = options.onRetry();
        retry.getEventPublisher().onRetry(event -> {
            Throwable error = Operations.unwrap(event.getLastThrowable());
            log.debug("Retrying {} after attempt {} failed: {}",
                    definition.key(), event.getNumberOfRetryAttempts(), error.toString());
            listener.onRetry(error, event.getNumberOfRetryAttempts());
        });
        return retry;
    }
}
