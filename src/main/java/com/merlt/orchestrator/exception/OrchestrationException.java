package com.merlt.orchestrator.exception;

/**
 * Base class for failures that end a query request. Carries the pipeline stage, the router retry
 * count reached and the trace id, so a failure can be reproduced from its log line alone.
 */
public abstract class OrchestrationException extends RuntimeException {
    private final PipelineStage stage;
    private final int retryCount;
    private final String traceId;

    protected OrchestrationException(String message, PipelineStage stage, int retryCount, String traceId) {
        this(message, stage, retryCount, traceId, null);
    }

    protected OrchestrationException(String message, PipelineStage stage, int retryCount, String traceId, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.retryCount = retryCount;
        this.traceId = traceId;
    }

    public PipelineStage getStage() {
        return this.stage;
    }

    public int getRetryCount() {
        return this.retryCount;
    }

    public String getTraceId() {
        return this.traceId;
    }

    /**
     * Message safe to show to the person who asked the question.
     */
    public abstract String getUserMessage();
}
