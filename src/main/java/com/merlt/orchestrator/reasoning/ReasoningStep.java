package com.merlt.orchestrator.reasoning;

import java.util.Map;

public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public ReasoningStep {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data);
    }

    public enum StepType {
        PLAN_GENERATION,
        PLAN_VALIDATION,
        QUERY_ENCODING,
        GATING,
        EXPERT_DISPATCH,
        EXPERT_OPINION,
        SYNTHESIS,
        REFINEMENT,
        ERROR
    }
}
