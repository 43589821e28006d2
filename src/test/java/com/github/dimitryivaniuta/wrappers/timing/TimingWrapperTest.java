package com.github.dimitryivaniuta.wrappers.timing;

import com.github.dimitryivaniuta.wrappers.operation.Operation;
import com.github.dimitryivaniuta.wrappers.operation.OperationDefinition;
import com.github.dimitryivaniuta.wrappers.support.WrapperTestRuntime;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimingWrapperTest {

    private final WrapperTestRuntime rt = new WrapperTestRuntime();
    private final List<String> lines = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        rt.close();
    }

    @Test
    void measureShouldReportDurationAndMemory() throws Throwable {
        Operation op = rt.wrappers.measure(OperationDefinition.sync("Report", "build"),
                        MeasureOptions.builder().memory(true).sink(lines::add).build())
                .wrap(args -> "pdf");

        assertThat(op.invoke()).isEqualTo("pdf");
        assertThat(lines).singleElement().asString()
                .startsWith("Report.build metrics: {duration=")
                .contains("memory=");
    }

    @Test
    void failuresShouldBeReportedAndRethrown() {
        Operation op = rt.wrappers.measure(OperationDefinition.sync("Report", "build"),
                        MeasureOptions.builder().sink(lines::add).build())
                .wrap(args -> {
                    throw new IllegalStateException("template missing");
                });

        assertThatThrownBy(op::invoke).hasMessage("template missing");
        assertThat(lines).singleElement().asString().matches("Report\\.build failed after \\d+\\.\\d{2}ms");
    }

    @Test
    void timedShouldRecordMicrometerTimer() throws Throwable {
        Operation op = rt.wrappers.timed(OperationDefinition.sync("Report", "build")).wrap(args -> "pdf");

        op.invoke();
        op.invoke();

        Timer timer = rt.registry.find("operation_wrappers_duration_seconds")
                .tag("operation", "Report.build")
                .tag("outcome", "success")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
    }
}
