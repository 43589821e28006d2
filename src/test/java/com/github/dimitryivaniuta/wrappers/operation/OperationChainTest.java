package com.github.dimitryivaniuta.wrappers.operation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationChainTest {

    @Test
    void shouldPlaceLaterWrappersFurtherOut() throws Throwable {
        List<String> trace = new ArrayList<>();

        Operation op = OperationChain.of(args -> {
                    trace.add("op");
                    return args[0];
                })
                .with(tracing("inner", trace))
                .with(tracing("outer", trace))
                .build();

        assertThat(op.invoke("x")).isEqualTo("x");
        assertThat(trace).containsExactly("outer", "inner", "op");
    }

    @Test
    void composeShouldTreatFirstElementAsOutermost() throws Throwable {
        List<String> trace = new ArrayList<>();

        Operation op = OperationChain.compose(
                List.of(tracing("a", trace), tracing("b", trace)),
                args -> "done");

        op.invoke();
        assertThat(trace).containsExactly("a", "b");
    }

    @Test
    void invokeAsyncShouldTurnSynchronousThrowIntoFailedFuture() {
        IllegalStateException boom = new IllegalStateException("boom");

        CompletableFuture<Object> result = Operations.invokeAsync(args -> { throw boom; }, new Object[0]);

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasCause(boom);
    }

    @Test
    void awaitShouldRethrowOriginalCause() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");
        CompletableFuture<Object> failed = CompletableFuture.failedFuture(cause);

        assertThatThrownBy(() -> Operations.await(failed)).isSameAs(cause);
        assertThat(Operations.unwrap(new CompletionException(cause))).isSameAs(cause);
    }

    @Test
    void definitionOfShouldDetectCompletionStageReturnType() throws Exception {
        OperationDefinition sync = OperationDefinition.of(Sample.class, Sample.class.getMethod("load"));
        OperationDefinition async = OperationDefinition.of(Sample.class, Sample.class.getMethod("loadAsync"));

        assertThat(sync.async()).isFalse();
        assertThat(async.async()).isTrue();
        assertThat(async.key()).isEqualTo("Sample.loadAsync");
    }

    private static OperationWrapper tracing(String name, List<String> trace) {
        return (args, next) -> {
            trace.add(name);
            return next.invoke(args);
        };
    }

    static class Sample {
        public String load() {
            return "v";
        }

        public CompletableFuture<String> loadAsync() {
            return CompletableFuture.completedFuture("v");
        }
    }
}
