package com.github.dimitryivaniuta.wrappers.cache;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationChain;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.support.WrapperTestRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheWrapperTest {

    private final WrapperTestRuntime rt = new WrapperTestRuntime();

    @AfterEach
    void tearDown() {
        rt.close();
    }

    @Test
    void shouldServeCachedValueUntilExpiry() throws Throwable {
        AtomicInteger counter = new AtomicInteger();
        OperationDefinition def = OperationDefinition.sync("Counter", "next");
        Operation op = OperationChain.of(args -> counter.incrementAndGet())
                .with(rt.wrappers.cached(def, CacheOptions.builder().expiryTime(Duration.ofMillis(100)).build()))
                .build();

        assertThat(op.invoke()).isEqualTo(1);

        rt.clock.advanceMillis(50);
        assertThat(op.invoke()).isEqualTo(1);

        rt.clock.advanceMillis(100);
        assertThat(op.invoke()).isEqualTo(2);
        assertThat(counter).hasValue(2);
    }

    @Test
    void shouldKeyEntriesByArguments() throws Throwable {
        AtomicInteger calls = new AtomicInteger();
        OperationDefinition def = OperationDefinition.sync("Prices", "quote");
        Operation op = OperationChain.of(args -> {
                    calls.incrementAndGet();
                    return args[0] + "-" + args[1];
                })
                .with(rt.wrappers.cached(def, CacheOptions.defaults()))
                .build();

        assertThat(op.invoke("a", 1)).isEqualTo("a-1");
        assertThat(op.invoke("a", 1)).isEqualTo("a-1");
        assertThat(op.invoke("a", 2)).isEqualTo("a-2");
        assertThat(calls).hasValue(2);
        assertThat(rt.counter("operation_wrappers_cache_hits_total", "Prices.quote")).isEqualTo(1.0);
    }

    @Test
    void invalidateShouldOnlyDropOwnEntries() throws Throwable {
        AtomicInteger users = new AtomicInteger();
        AtomicInteger orders = new AtomicInteger();
        CacheWrapper usersCache = rt.wrappers.cached(OperationDefinition.sync("Repo", "users"), CacheOptions.defaults());
        CacheWrapper ordersCache = rt.wrappers.cached(OperationDefinition.sync("Repo", "orders"), CacheOptions.defaults());
        Operation loadUsers = usersCache.wrap(args -> users.incrementAndGet());
        Operation loadOrders = ordersCache.wrap(args -> orders.incrementAndGet());

        loadUsers.invoke();
        loadOrders.invoke();

        usersCache.invalidate();

        assertThat(loadUsers.invoke()).isEqualTo(2);
        assertThat(loadOrders.invoke()).isEqualTo(1);
    }

    @Test
    void customKeysShouldNotCollideAcrossOperations() throws Throwable {
        CacheOptions byFirstArg = CacheOptions.builder().key(args -> String.valueOf(args[0])).build();
        Operation a = rt.wrappers.cached(OperationDefinition.sync("S", "a"), byFirstArg).wrap(args -> "a");
        Operation b = rt.wrappers.cached(OperationDefinition.sync("S", "b"), byFirstArg).wrap(args -> "b");

        assertThat(a.invoke(1)).isEqualTo("a");
        assertThat(b.invoke(1)).isEqualTo("b");
    }

    @Test
    void asyncHitShouldReturnCompletedFutureAndFailuresShouldNotBeCached() throws Throwable {
        AtomicInteger calls = new AtomicInteger();
        OperationDefinition def = OperationDefinition.async("Remote", "fetch");
        Operation op = rt.wrappers.cached(def, CacheOptions.defaults()).wrap(args -> {
            int n = calls.incrementAndGet();
            if (n == 1) return CompletableFuture.failedFuture(new IllegalStateException("down"));
            return CompletableFuture.completedFuture("v" + n);
        });

        CompletableFuture<?> failed = (CompletableFuture<?>) op.invoke();
        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalStateException.class);

        assertThat(((CompletableFuture<?>) op.invoke()).join()).isEqualTo("v2");

        Object hit = op.invoke();
        assertThat(hit).isInstanceOf(CompletableFuture.class);
        assertThat(((CompletableFuture<?>) hit).join()).isEqualTo("v2");
        assertThat(calls).hasValue(2);
    }

    @Test
    void memoizeShouldNeverExpire() throws Throwable {
        AtomicInteger calls = new AtomicInteger();
        Operation op = rt.wrappers.memoize(OperationDefinition.sync("Math", "fib"))
                .wrap(args -> calls.incrementAndGet());

        op.invoke(10);
        rt.clock.advance(Duration.ofDays(30));
        op.invoke(10);

        assertThat(calls).hasValue(1);
    }
}
