package com.merlt.orchestrator.exception;

public class PlanGenerationFailedException extends OrchestrationException {

    public PlanGenerationFailedException(String message, int retryCount, String traceId, Throwable cause) {
        super(message, PipelineStage.PLAN_GENERATION, retryCount, traceId, cause);
    }

    @Override
    public String getUserMessage() {
        return "The reasoning service is temporarily unavailable. Please try again later.";
    }
}
