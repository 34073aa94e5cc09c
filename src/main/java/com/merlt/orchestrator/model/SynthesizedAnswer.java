package com.merlt.orchestrator.model;

import java.util.List;

public record SynthesizedAnswer(
        String traceId,
        String text,
        SynthesisMode mode,
        List<ExpertContribution> contributions,
        double confidence,
        double minAgreement,
        ExpertType favouredExpert,
        List<String> conflicts,
        List<ExpertOpinion> opinions,
        ExecutionPlan plan,
        int iterations) {

    public SynthesizedAnswer {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        opinions = opinions == null ? List.of() : List.copyOf(opinions);
    }

    public SynthesizedAnswer withContext(String traceId, ExecutionPlan plan, int iterations) {
        return new SynthesizedAnswer(traceId, this.text, this.mode, this.contributions, this.confidence,
                this.minAgreement, this.favouredExpert, this.conflicts, this.opinions, plan, iterations);
    }
}
