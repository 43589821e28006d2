package com.github.dimitryivaniuta.wrappers.lifecycle;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationChain;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.support.WrapperTestRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EffectWrappersTest {

    private final WrapperTestRuntime rt = new WrapperTestRuntime();
    private final List<String> trace = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        rt.close();
    }

    @Test
    void hooksShouldRunAroundTheCallInOrder() throws Throwable {
        OperationDefinition def = OperationDefinition.sync("Orders", "place");
        Operation op = OperationChain.of(args -> {
                    trace.add("op");
                    return "order-1";
                })
                .with(rt.wrappers.effectBefore(def, ctx -> trace.add("before " + ctx.args())))
                .with(rt.wrappers.effectAfter(def, ctx -> trace.add("after " + ctx.result())))
                .build();

        assertThat(op.invoke("book")).isEqualTo("order-1");
        assertThat(trace).containsExactly("before [book]", "op", "after order-1");
    }

    @Test
    void contextShouldDescribeTheOperationAndBeReadOnly() throws Throwable {
        AtomicReference<EffectContext> seen = new AtomicReference<>();
        OperationDefinition def = OperationDefinition.sync("Orders", "place");
        Operation op = rt.wrappers.effectBefore(def, ctx -> {
            seen.set(ctx);
            return null;
        }).wrap(args -> "ok");

        op.invoke("book", 2);

        EffectContext ctx = seen.get();
        assertThat(ctx.operationName()).isEqualTo("place");
        assertThat(ctx.scopeName()).isEqualTo("Orders");
        assertThat(ctx.args()).containsExactly("book", 2);
        assertThatThrownBy(() -> ctx.args().set(0, "other")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void afterHookShouldNotChangeTheResultAndShouldBeAwaited() throws Throwable {
        OperationDefinition def = OperationDefinition.async("Orders", "placeAsync");
        Operation op = rt.wrappers.effectAfter(def, ctx -> CompletableFuture.runAsync(() -> {
            sleepQuietly(50);
            trace.add("audit " + ctx.result());
        }, rt.workers)).wrap(args -> CompletableFuture.completedFuture("order-2"));

        Object result = ((CompletableFuture<?>) op.invoke()).get(2, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("order-2");
        assertThat(trace).containsExactly("audit order-2");
    }

    @Test
    void pendingBeforeHookShouldHoldBackTheAsyncResult() throws Exception {
        CompletableFuture<String> hookDone = new CompletableFuture<>();
        Operation op = rt.wrappers.effectBefore(OperationDefinition.async("Orders", "quoteAsync"), ctx -> hookDone)
                .wrap(args -> CompletableFuture.completedFuture("quote-7"));

        CompletableFuture<?> result = (CompletableFuture<?>) invoke(op);

        assertThat(result).isNotDone();

        hookDone.complete("hook value");

        assertThat(result.get(2, TimeUnit.SECONDS)).isEqualTo("quote-7");
    }

    @Test
    void pendingBeforeHookShouldHoldBackTheSyncResult() throws Exception {
        CompletableFuture<String> hookDone = new CompletableFuture<>();
        CountDownLatch operationRan = new CountDownLatch(1);
        Operation op = rt.wrappers.effectBefore(OperationDefinition.sync("Orders", "quote"), ctx -> hookDone)
                .wrap(args -> {
                    operationRan.countDown();
                    return "quote-8";
                });

        CompletableFuture<Object> caller = CompletableFuture.supplyAsync(() -> invoke(op), rt.workers);

        assertThat(operationRan.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        assertThat(caller).isNotDone();

        hookDone.complete("hook value");

        assertThat(caller.get(2, TimeUnit.SECONDS)).isEqualTo("quote-8");
    }

    @Test
    void afterHookShouldNotRunOnFailure() {
        Operation op = rt.wrappers.effectAfter(OperationDefinition.sync("Orders", "place"), ctx -> trace.add("after"))
                .wrap(args -> {
                    throw new IllegalStateException("rejected");
                });

        assertThatThrownBy(op::invoke).isInstanceOf(IllegalStateException.class);
        assertThat(trace).isEmpty();
    }

    @Test
    void errorHookShouldSeeTheErrorAndOriginalShouldBeRethrown() {
        IllegalStateException boom = new IllegalStateException("boom");
        Operation op = rt.wrappers.effectError(OperationDefinition.sync("Orders", "place"),
                        ctx -> trace.add("error " + ctx.error().getMessage()))
                .wrap(args -> {
                    throw boom;
                });

        assertThatThrownBy(op::invoke).isSameAs(boom);
        assertThat(trace).containsExactly("error boom");
    }

    @Test
    void failingErrorHookShouldBeAttachedAsSuppressed() {
        IllegalStateException boom = new IllegalStateException("boom");
        Operation op = rt.wrappers.effectError(OperationDefinition.sync("Orders", "place"), ctx -> {
                    throw new IllegalArgumentException("hook broke");
                })
                .wrap(args -> {
                    throw boom;
                });

        assertThatThrownBy(op::invoke).isSameAs(boom);
        assertThat(boom.getSuppressed()).hasSize(1);
        assertThat(boom.getSuppressed()[0]).hasMessage("hook broke");
    }

    @Test
    void asyncErrorHookShouldRethrowOriginal() {
        IllegalStateException boom = new IllegalStateException("boom");
        Operation op = rt.wrappers.effectError(OperationDefinition.async("Orders", "placeAsync"),
                        ctx -> CompletableFuture.runAsync(() -> trace.add("error"), rt.workers))
                .wrap(args -> CompletableFuture.failedFuture(boom));

        CompletableFuture<?> result = (CompletableFuture<?>) invoke(op);

        assertThatThrownBy(() -> result.get(2, TimeUnit.SECONDS)).hasCause(boom);
        assertThat(trace).containsExactly("error");
    }

    private static Object invoke(Operation op) {
        try {
            return op.invoke();
        } catch (Throwable ex) {
            throw new AssertionError(ex);
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
