package com.github.dimitryivaniuta.wrappers.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.wrappers.OperationWrappers;
import com.github.dimitryivaniuta.wrappers.cache.TtlCaffeineCacheManager;
import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.proxy.CachedOperations;
import com.github.dimitryivaniuta.wrappers.proxy.OperationWrappersBeanPostProcessor;
import com.github.dimitryivaniuta.wrappers.proxy.OperationWrappersProperties;
import com.github.dimitryivaniuta.wrappers.proxy.WrapperChainFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runtime for operation wrappers:
 * - clock (replace it in tests to drive TTLs, windows and breaker timeouts)
 * - scheduler for retry waits, timeout timers and debounce timers
 * - daemon executor that runs synchronous operations under a timeout
 * - Caffeine cache manager with per-TTL caches ("operation-results:ttl=100")
 * - annotation post-processor
 *
 * The cache manager and the key mapper are private to the wrappers and are not exposed as beans,
 * so the application's own CacheManager / ObjectMapper stay untouched.
 */
@AutoConfiguration
@EnableConfigurationProperties(OperationWrappersProperties.class)
public class OperationWrappersAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "operationWrappersScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService operationWrappersScheduler(OperationWrappersProperties props) {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("op-wrappers-timer-");
        threads.setDaemon(true);
        return Executors.newScheduledThreadPool(Math.max(1, props.getSchedulerThreads()), threads);
    }

    @Bean(name = "operationWrappersTimeoutExecutor", destroyMethod = "shutdownNow")
    public ExecutorService operationWrappersTimeoutExecutor() {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("op-wrappers-timeout-");
        threads.setDaemon(true);
        return Executors.newCachedThreadPool(threads);
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationWrapperMetrics operationWrapperMetrics(ObjectProvider<MeterRegistry> registry) {
        return new OperationWrapperMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public OperationWrappers operationWrappers(Clock clock,
                                               @Qualifier("operationWrappersScheduler") ScheduledExecutorService scheduler,
                                               @Qualifier("operationWrappersTimeoutExecutor") ExecutorService timeoutExecutor,
                                               OperationWrapperMetrics metrics,
                                               OperationWrappersProperties props) {
        return new OperationWrappers(
                clock,
                scheduler,
                timeoutExecutor,
                cacheManager(clock, props.getCache().getMaximumSize()),
                cacheKeyMapper(),
                metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public CachedOperations cachedOperations() {
        return new CachedOperations();
    }

    @Bean
    public WrapperChainFactory wrapperChainFactory(OperationWrappers wrappers,
                                                   BeanFactory beanFactory,
                                                   CachedOperations cachedOperations) {
        return new WrapperChainFactory(wrappers, beanFactory, cachedOperations);
    }

    @Bean
    public static OperationWrappersBeanPostProcessor operationWrappersBeanPostProcessor(
            OperationWrappersProperties props,
            ObjectProvider<WrapperChainFactory> chainFactory) {
        return new OperationWrappersBeanPostProcessor(props, chainFactory);
    }

    /**
     * Caffeine ticks with the injected clock so a fixed or mutable clock also drives expiry.
     * {@code maximumSize} bounds the expiring caches; memoized and no-expiry entries are never evicted.
     */
    static TtlCaffeineCacheManager cacheManager(Clock clock, long maximumSize) {
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .ticker(ticker)
                        // run maintenance inline; keeps expiry deterministic
                        .executor(Runnable::run),
                maximumSize
        );
    }

    /**
     * Deterministic JSON for default cache keys: equal arguments always serialize the same way.
     */
    static ObjectMapper cacheKeyMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }
}
