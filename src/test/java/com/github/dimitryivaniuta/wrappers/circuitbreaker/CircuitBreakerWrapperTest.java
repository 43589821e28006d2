package com.github.dimitryivaniuta.wrappers.circuitbreaker;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.support.WrapperTestRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerWrapperTest {

    private final WrapperTestRuntime rt = new WrapperTestRuntime();
    private final List<CircuitState> transitions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean failing = new AtomicBoolean(true);
    private final AtomicInteger invocations = new AtomicInteger();

    @AfterEach
    void tearDown() {
        rt.close();
    }

    @Test
    void shouldOpenAfterThresholdAndRejectWithoutInvoking() {
        CircuitBreakerWrapper wrapper = breaker(OperationDefinition.sync("Payments", "charge"));
        Operation op = wrapper.wrap(this::backend);

        assertThatThrownBy(op::invoke).isInstanceOf(IllegalStateException.class);
        assertThat(wrapper.breaker().getState()).isEqualTo(CircuitState.CLOSED);
        assertThatThrownBy(op::invoke).isInstanceOf(IllegalStateException.class);
        assertThat(wrapper.breaker().getState()).isEqualTo(CircuitState.OPEN);

        assertThatThrownBy(op::invoke)
                .isInstanceOf(CircuitBreakerOpenException.class)
                .hasMessage("Circuit breaker is open for charge");
        assertThat(invocations).hasValue(2);
        assertThat(transitions).containsExactly(CircuitState.OPEN);
    }

    @Test
    void successfulTrialAfterResetTimeoutShouldClose() throws Throwable {
        CircuitBreakerWrapper wrapper = breaker(OperationDefinition.sync("Payments", "charge"));
        Operation op = wrapper.wrap(this::backend);
        tripOpen(op);

        rt.clock.advance(Duration.ofMillis(999));
        assertThatThrownBy(op::invoke).isInstanceOf(CircuitBreakerOpenException.class);

        rt.clock.advance(Duration.ofMillis(1));
        failing.set(false);
        assertThat(op.invoke()).isEqualTo("charged");

        assertThat(wrapper.breaker().getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(wrapper.breaker().getFailures()).isZero();
        assertThat(transitions).containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED);
    }

    @Test
    void failedTrialShouldReopen() {
        CircuitBreakerWrapper wrapper = breaker(OperationDefinition.sync("Payments", "charge"));
        Operation op = wrapper.wrap(this::backend);
        tripOpen(op);

        rt.clock.advance(Duration.ofSeconds(1));
        assertThatThrownBy(op::invoke).isInstanceOf(IllegalStateException.class);

        assertThat(wrapper.breaker().getState()).isEqualTo(CircuitState.OPEN);
        assertThat(transitions).containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.OPEN);
    }

    @Test
    void halfOpenShouldAdmitExactlyOneTrial() throws Throwable {
        CompletableFuture<Object> trial = new CompletableFuture<>();
        OperationDefinition def = OperationDefinition.async("Payments", "chargeAsync");
        CircuitBreakerWrapper wrapper = breaker(def);
        AtomicInteger calls = new AtomicInteger();
        Operation op = wrapper.wrap(args -> calls.incrementAndGet() <= 2
                ? CompletableFuture.failedFuture(new IllegalStateException("down"))
                : trial);

        ((CompletableFuture<?>) op.invoke()).exceptionally(ex -> null).join();
        ((CompletableFuture<?>) op.invoke()).exceptionally(ex -> null).join();
        assertThat(wrapper.breaker().getState()).isEqualTo(CircuitState.OPEN);

        rt.clock.advance(Duration.ofSeconds(1));
        CompletableFuture<?> first = (CompletableFuture<?>) op.invoke();
        CompletableFuture<?> second = (CompletableFuture<?>) op.invoke();

        assertThat(first).isNotDone();
        assertThatThrownBy(second::join).hasCauseInstanceOf(CircuitBreakerOpenException.class);

        trial.complete("ok");
        assertThat(first.join()).isEqualTo("ok");
        assertThat(wrapper.breaker().getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void sharedStateShouldBeVisibleToEveryWrapper() {
        OperationDefinition def = OperationDefinition.sync("Payments", "charge");
        CircuitBreaker shared = rt.wrappers.circuitBreakerState(def, CircuitBreakerOptions.builder()
                .failureThreshold(1)
                .resetTimeout(Duration.ofSeconds(1))
                .build());
        Operation first = rt.wrappers.circuitBreaker(def, shared).wrap(this::backend);
        Operation second = rt.wrappers.circuitBreaker(def, shared).wrap(this::backend);

        assertThatThrownBy(first::invoke).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(second::invoke).isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(rt.counter("operation_wrappers_circuit_rejected_total", "Payments.charge")).isEqualTo(1.0);
    }

    private CircuitBreakerWrapper breaker(OperationDefinition def) {
        return rt.wrappers.circuitBreaker(def, CircuitBreakerOptions.builder()
                .failureThreshold(2)
                .resetTimeout(Duration.ofSeconds(1))
                .onStateChange(transitions::add)
                .build());
    }

    private void tripOpen(Operation op) {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(op::invoke).isInstanceOf(IllegalStateException.class);
        }
    }

    private Object backend(Object... args) {
        invocations.incrementAndGet();
        if (failing.get()) throw new IllegalStateException("backend down");
        return "charged";
    }
}
