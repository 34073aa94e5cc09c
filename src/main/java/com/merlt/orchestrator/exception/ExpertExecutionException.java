package com.merlt.orchestrator.exception;

import com.merlt.orchestrator.model.ExpertType;

/**
 * Raised inside an expert run. The dispatcher converts it into a degraded opinion; it never
 * reaches the caller of a query.
 */
public class ExpertExecutionException extends RuntimeException {
    private final ExpertType expert;

    public ExpertExecutionException(ExpertType expert, String message, Throwable cause) {
        super(message, cause);
        this.expert = expert;
    }

    public ExpertType getExpert() {
        return this.expert;
    }
}
