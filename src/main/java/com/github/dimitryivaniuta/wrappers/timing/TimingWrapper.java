package com.github.dimitryivaniuta.wrappers.timing;

import com.github.dimitryivaniuta.wrappers.metrics.OperationWrapperMetrics;
import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.operation.OperationWrapper;
import com.github.dimitryivaniuta.wrappers.operation.Operations;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Measures wall time of each call (async: until the future settles) and reports it to a
 * {@link DiagnosticSink} and to the {@code operation_wrappers_duration_seconds} timer.
 *
 * <p>{@link Mode#TIMED} writes "Scope.name took 1.23ms"; {@link Mode#MEASURE} writes a metrics map.
 */
@Slf4j
public class TimingWrapper implements OperationWrapper {

    public enum Mode { TIMED, MEASURE }

    private static final String DURATION_METRIC = "operation_wrappers_duration_seconds";

    private final OperationDefinition definition;
    private final Mode mode;
    private final boolean memory;
    private final DiagnosticSink sink;
    private final OperationWrapperMetrics metrics;

    public TimingWrapper(OperationDefinition definition,
                         Mode mode,
                         MeasureOptions options,
                         OperationWrapperMetrics metrics) {
        this.definition = definition;
        this.mode = mode;
        this.memory = options != null && options.memory();
        this.sink = (options != null && options.sink() != null) ? options.sink() : DiagnosticSink.info(log);
        this.metrics = metrics;
    }

    @Override
    public Object invoke(Object[] args, Operation next) throws Throwable {
        long start = System.nanoTime();
        long startHeap = memory ? usedHeap() : 0L;

        Object result;
        try {
            result = next.invoke(args);
        } catch (Throwable ex) {
            report(start, startHeap, false);
            throw ex;
        }

        if (Operations.isPending(result)) {
            return Operations.toFuture(result).whenComplete((value, ex) -> report(start, startHeap, ex == null));
        }

        report(start, startHeap, true);
        return result;
    }

    private void report(long startNanos, long startHeap, boolean success) {
        long elapsed = System.nanoTime() - startNanos;
        metrics.recordDuration(DURATION_METRIC, definition.key(), success ? "success" : "failure", elapsed);

        String millis = String.format(Locale.ROOT, "%.2f", elapsed / 1_000_000.0);
        if (!success) {
            sink.log(definition.key() + " failed after " + millis + "ms");
            return;
        }
        if (mode == Mode.TIMED) {
            sink.log(definition.key() + " took " + millis + "ms");
            return;
        }

        Map<String, Number> measured = new LinkedHashMap<>();
        measured.put("duration", Double.parseDouble(millis));
        if (memory) measured.put("memory", usedHeap() - startHeap);
        sink.log(definition.key() + " metrics: " + measured);
    }

    private static long usedHeap() {
        Runtime rt = Runtime.getRuntime();
        return rt.totalMemory() - rt.freeMemory();
    }
}
