package com.merlt.orchestrator.exception;

public class RequestCancelledException extends OrchestrationException {

    public RequestCancelledException(String message, PipelineStage stage, String traceId) {
        super(message, stage, 0, traceId);
    }

    @Override
    public String getUserMessage() {
        return "The request was cancelled before an answer was ready.";
    }
}
