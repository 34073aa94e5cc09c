package com.merlt.orchestrator.exception;

public enum PipelineStage {
    PLAN_GENERATION,
    PLAN_VALIDATION,
    EXPERT_EXECUTION,
    SYNTHESIS,
    FEEDBACK
}
