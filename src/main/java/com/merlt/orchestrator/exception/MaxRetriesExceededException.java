package com.merlt.orchestrator.exception;

import java.util.List;

public class MaxRetriesExceededException extends OrchestrationException {
    private final List<String> rejectionReasons;

    public MaxRetriesExceededException(int retryCount, List<String> rejectionReasons, String traceId) {
        super("No valid execution plan after " + retryCount + " attempts: " + String.join("; ", rejectionReasons),
                PipelineStage.PLAN_VALIDATION, retryCount, traceId);
        this.rejectionReasons = List.copyOf(rejectionReasons);
    }

    public List<String> getRejectionReasons() {
        return this.rejectionReasons;
    }

    @Override
    public String getUserMessage() {
        return "The question could not be planned right now. Please rephrase it or try again later.";
    }
}
