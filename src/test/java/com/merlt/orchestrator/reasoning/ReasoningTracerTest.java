package com.merlt.orchestrator.reasoning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class ReasoningTracerTest {

    @Test
    @DisplayName("Completed traces are retrievable by id and never store the raw query")
    void storesCompletedTraces() {
        ReasoningTracer tracer = new ReasoningTracer();
        ReasoningTrace trace = tracer.startTrace("Is the tenant liable for damage?");
        tracer.addStep(trace, ReasoningStep.StepType.GATING, "Gating weights", "{}", 1L);
        tracer.endTrace(trace);

        ReasoningTrace stored = tracer.getTrace(trace.getTraceId());
        assertThat(stored).isSameAs(trace);
        assertThat(stored.isCompleted()).isTrue();
        assertThat(stored.getQuerySummary()).doesNotContain("tenant");
        assertThat(stored.getSteps(ReasoningStep.StepType.GATING)).hasSize(1);
    }

    @Test
    @DisplayName("timed() records a failing operation as an ERROR step and rethrows")
    void timedFailure() {
        ReasoningTracer tracer = new ReasoningTracer();
        ReasoningTrace trace = tracer.startTrace("q");

        assertThatThrownBy(() -> tracer.timed(trace, ReasoningStep.StepType.SYNTHESIS, "Synthesis", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(trace.getSteps(ReasoningStep.StepType.ERROR)).extracting(ReasoningStep::label)
                .containsExactly("Synthesis (Failed)");
    }

    @Test
    @DisplayName("A disabled tracer records nothing")
    void disabled() {
        ReasoningTracer tracer = new ReasoningTracer();
        ReflectionTestUtils.setField(tracer, "enabled", false);
        ReasoningTrace trace = tracer.startTrace("q");
        tracer.addStep(trace, ReasoningStep.StepType.GATING, "Gating", "", 0L);
        tracer.endTrace(trace);

        assertThat(trace.getSteps()).isEmpty();
        assertThat(tracer.getTrace(trace.getTraceId())).isNull();
    }
}
