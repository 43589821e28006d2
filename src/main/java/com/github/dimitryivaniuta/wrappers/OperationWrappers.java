package com.github.dimitryivaniuta.wrappers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.wrappers.cache.CacheOptions;
import com.github.dimitryivaniuta.wrappers.cache.CacheWrapper;
import com.github.dimitryivaniuta.wrappers.cache.TtlCaffeineCacheManager;
import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitBreaker;
import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitBreakerOptions;
import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitBreakerWrapper;
import com.github.dimitryivaniuta.wrappers.circuitbreaker.CircuitStateListener;
import com.github.dimitryivaniuta.wrappers.fallback.FallbackWrapper;
import com.github.dimitryivaniuta.wrappers.guard.DeprecationWrapper;
import com.github.dimitryivaniuta.wrappers.guard.GuardPredicate;
import com.github.dimitryivaniuta.wrappers.guard.GuardWrapper;
import com.github.dimitryivaniuta.wrappers.lifecycle.EffectAfterWrapper;
import com.github.dimitryivaniuta.wrappers.lifecycle.EffectBeforeWrapper;
import com.github.dimitryivaniuta.wrappers.lifecycle.EffectErrorWrapper;
import com.github.dimitryivaniuta.wrappers.lifecycle.EffectHook;
import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.ratelimit.RateLimitOptions;
import com.github.dimitryivaniuta.wrappers.ratelimit.RateLimitWrapper;
import com.github.dimitryivaniuta.wrappers.ratelimit.SlidingWindowRateLimiter;
import com.github.dimitryivaniuta.wrappers.retry.RetryOptions;
import com.github.dimitryivaniuta.wrappers.retry.RetryWrapper;
import com.github.dimitryivaniuta.wrappers.shaping.DebounceWrapper;
import com.github.dimitryivaniuta.wrappers.shaping.ShapingVariant;
import com.github.dimitryivaniuta.wrappers.shaping.ThrottleWrapper;
import com.github.dimitryivaniuta.wrappers.timeout.TimeoutWrapper;
import com.github.dimitryivaniuta.wrappers.timing.MeasureOptions;
import com.github.dimitryivaniuta.wrappers.timing.TimingWrapper;
import lombok.Getter;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point for building wrappers by hand. Each method creates a wrapper bound to one
 * {@link OperationDefinition}; stack them with {@link com.github.dimitryivaniuta.wrappers.operation.OperationChain}.
 *
 * <pre>{@code
 * Operation loadUser = OperationChain.of(args -> repo.find((Long) args[0]))
 *         .with(wrappers.retry(def, RetryOptions.builder().maxRetries(2).build()))
 *         .with(wrappers.cached(def, CacheOptions.builder().expiryTime(Duration.ofSeconds(30)).build()))
 *         .build();
 * }</pre>
 */
@Getter
public class OperationWrappers {

    public static final String RESULTS_CACHE = "operation-results";
    public static final String MEMOIZE_CACHE = "operation-memoize";

    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService timeoutExecutor;
    private final CacheManager cacheManager;
    private final ObjectMapper objectMapper;
    private final OperationWrapperMetrics metrics;

    public OperationWrappers(Clock clock,
                             ScheduledExecutorService scheduler,
                             ExecutorService timeoutExecutor,
                             CacheManager cacheManager,
                             ObjectMapper objectMapper,
                             OperationWrapperMetrics metrics) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.timeoutExecutor = Objects.requireNonNull(timeoutExecutor, "timeoutExecutor must not be null");
        this.cacheManager = Objects.requireNonNull(cacheManager, "cacheManager must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    // ---- Cache ----
    public CacheWrapper cached(OperationDefinition definition, CacheOptions options) {
        CacheOptions opts = (options != null) ? options : CacheOptions.defaults();
        Cache cache = cache(TtlCaffeineCacheManager.cacheName(RESULTS_CACHE, opts.expiryTime()));
        return new CacheWrapper(definition, cache, opts.key(), objectMapper, metrics);
    }

    /**
     * Permanent cache with no invalidation surface.
     */
    public OperationWrapper memoize(OperationDefinition definition) {
        return new CacheWrapper(definition, cache(MEMOIZE_CACHE), null, objectMapper, metrics);
    }

    // ---- Resilience ----
    public RetryWrapper retry(OperationDefinition definition, RetryOptions options) {
        return new RetryWrapper(definition, options, scheduler, metrics);
    }

    public TimeoutWrapper timeout(OperationDefinition definition, Duration timeout) {
        return new TimeoutWrapper(definition, timeout, scheduler, timeoutExecutor, metrics);
    }

    /**
     * Creates the breaker state object for one definition. Share it between wrappers to share state.
     */
    public CircuitBreaker circuitBreakerState(OperationDefinition definition, CircuitBreakerOptions options) {
        CircuitStateListener userListener = options.onStateChange();
        CircuitStateListener listener = state -> {
            metrics.circuitTransition(definition.key(), state.name());
            userListener.onStateChange(state);
        };
        CircuitBreakerOptions withMetrics =
                new CircuitBreakerOptions(options.failureThreshold(), options.resetTimeout(), listener);
        return new CircuitBreaker(definition.key(), withMetrics, clock);
    }

    public CircuitBreakerWrapper circuitBreaker(OperationDefinition definition, CircuitBreakerOptions options) {
        return circuitBreaker(definition, circuitBreakerState(definition, options));
    }

    public CircuitBreakerWrapper circuitBreaker(OperationDefinition definition, CircuitBreaker shared) {
        return new CircuitBreakerWrapper(definition, shared, metrics);
    }

    public FallbackWrapper fallback(OperationDefinition definition, Operation fallback) {
        return new FallbackWrapper(definition, Objects.requireNonNull(fallback, "fallback must not be null"));
    }

    public SlidingWindowRateLimiter rateLimiterState(RateLimitOptions options) {
        return new SlidingWindowRateLimiter(options.limit(), options.window(), clock);
    }

    public RateLimitWrapper rateLimited(OperationDefinition definition, RateLimitOptions options) {
        return rateLimited(definition, options, rateLimiterState(options));
    }

    public RateLimitWrapper rateLimited(OperationDefinition definition,
                                        RateLimitOptions options,
                                        SlidingWindowRateLimiter shared) {
        return new RateLimitWrapper(definition, shared, options.key(), metrics);
    }

    // ---- Call shaping ----
    public DebounceWrapper debounceSync(OperationDefinition definition, Duration delay) {
        return new DebounceWrapper(definition, delay, ShapingVariant.SYNC, scheduler);
    }

    public DebounceWrapper debounceAsync(OperationDefinition definition, Duration delay) {
        return new DebounceWrapper(definition, delay, ShapingVariant.ASYNC, scheduler);
    }

    public ThrottleWrapper throttleSync(OperationDefinition definition, Duration interval) {
        return new ThrottleWrapper(definition, interval, ShapingVariant.SYNC, clock);
    }

    public ThrottleWrapper throttleAsync(OperationDefinition definition, Duration interval) {
        return new ThrottleWrapper(definition, interval, ShapingVariant.ASYNC, clock);
    }

    // ---- Lifecycle ----
    public EffectBeforeWrapper effectBefore(OperationDefinition definition, EffectHook hook) {
        return new EffectBeforeWrapper(definition, hook);
    }

    public EffectAfterWrapper effectAfter(OperationDefinition definition, EffectHook hook) {
        return new EffectAfterWrapper(definition, hook);
    }

    public EffectErrorWrapper effectError(OperationDefinition definition, EffectHook hook) {
        return new EffectErrorWrapper(definition, hook);
    }

    // ---- Diagnostics and guards ----
    public TimingWrapper timed(OperationDefinition definition) {
        return new TimingWrapper(definition, TimingWrapper.Mode.TIMED, null, metrics);
    }

    public TimingWrapper measure(OperationDefinition definition, MeasureOptions options) {
        return new TimingWrapper(definition, TimingWrapper.Mode.MEASURE, options, metrics);
    }

    /**
     * The guard may answer with a {@code Boolean} or a {@code CompletionStage<Boolean>}.
     */
    public GuardWrapper guard(OperationDefinition definition, GuardPredicate guard) {
        return new GuardWrapper(definition, guard);
    }

    public DeprecationWrapper deprecate(OperationDefinition definition, String message) {
        return new DeprecationWrapper(definition, message);
    }

    private Cache cache(String name) {
        Cache cache = cacheManager.getCache(name);
        if (cache == null) throw new IllegalStateException("CacheManager returned no cache for " + name);
        return cache;
    }
}
