package com.merlt.orchestrator.model;

public record StopCriteria(int maxIterations, double minConfidence) {

    public static StopCriteria defaults() {
        return new StopCriteria(1, 0.0);
    }
}
