package com.merlt.orchestrator.exception;

import com.merlt.orchestrator.model.ExpertOpinion;
import java.util.List;

public class InsufficientEvidenceException extends OrchestrationException {
    private final List<ExpertOpinion> opinions;

    public InsufficientEvidenceException(String message, List<ExpertOpinion> opinions, String traceId) {
        super(message, PipelineStage.SYNTHESIS, 0, traceId);
        this.opinions = opinions == null ? List.of() : List.copyOf(opinions);
    }

    public List<ExpertOpinion> getOpinions() {
        return this.opinions;
    }

    @Override
    public String getUserMessage() {
        return "Not enough evidence was gathered to answer this question.";
    }
}
