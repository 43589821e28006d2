package com.github.dimitryivaniuta.wrappers.timeout;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapperException;
import com.github.dimitryivaniuta.wrappers.support.WrapperTestRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TimeoutWrapperTest {

    private final WrapperTestRuntime rt = new WrapperTestRuntime();

    @AfterEach
    void tearDown() {
        rt.close();
    }

    @Test
    void fastOperationShouldPassThrough() throws Throwable {
        Operation op = rt.wrappers.timeout(OperationDefinition.sync("Svc", "fast"), Duration.ofSeconds(1))
                .wrap(args -> "done");

        assertThat(op.invoke()).isEqualTo("done");
    }

    @Test
    void slowOperationShouldTimeOutButKeepRunning() {
        AtomicBoolean finished = new AtomicBoolean();
        Operation op = rt.wrappers.timeout(OperationDefinition.sync("Svc", "slow"), Duration.ofMillis(50))
                .wrap(args -> {
                    Thread.sleep(300);
                    finished.set(true);
                    return "late";
                });

        assertThatThrownBy(op::invoke)
                .isInstanceOf(OperationTimeoutException.class)
                .hasMessage("slow timed out after 50ms")
                .satisfies(ex -> assertThat(((OperationWrapperException) ex).getKind())
                        .isEqualTo(OperationWrapperException.Kind.TIMEOUT));

        // not cancelled
        await().atMost(2, TimeUnit.SECONDS).untilTrue(finished);
    }

    @Test
    void operationFailureShouldSurfaceUnchanged() {
        IllegalStateException boom = new IllegalStateException("boom");
        Operation op = rt.wrappers.timeout(OperationDefinition.sync("Svc", "failing"), Duration.ofSeconds(1))
                .wrap(args -> {
                    throw boom;
                });

        assertThatThrownBy(op::invoke).isSameAs(boom);
    }

    @Test
    void pendingAsyncOperationShouldFailWithTimeout() throws Throwable {
        CountDownLatch never = new CountDownLatch(1);
        Operation op = rt.wrappers.timeout(OperationDefinition.async("Svc", "hang"), Duration.ofMillis(30))
                .wrap(args -> CompletableFuture.supplyAsync(() -> {
                    try {
                        never.await();
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return "never";
                }, rt.workers));

        CompletableFuture<?> result = (CompletableFuture<?>) op.invoke();

        assertThatThrownBy(() -> result.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(OperationTimeoutException.class);
        assertThat(rt.counter("operation_wrappers_timeouts_total", "Svc.hang")).isEqualTo(1.0);
        never.countDown();
    }

    @Test
    void asyncResultBeforeDeadlineShouldWin() throws Throwable {
        Operation op = rt.wrappers.timeout(OperationDefinition.async("Svc", "quick"), Duration.ofSeconds(1))
                .wrap(args -> CompletableFuture.completedFuture(42));

        assertThat(((CompletableFuture<?>) op.invoke()).get(1, TimeUnit.SECONDS)).isEqualTo(42);
    }
}
