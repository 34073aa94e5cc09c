package com.merlt.orchestrator.model;

public enum OpinionFlag {
    TIMED_OUT("timed_out"),
    INCOMPLETE_EVIDENCE("incomplete_evidence"),
    FAILED("expert_error"),
    CANCELLED("cancelled");

    private final String label;

    OpinionFlag(String label) {
        this.label = label;
    }

    public String label() {
        return this.label;
    }

    /** True for flags that make an opinion unusable for synthesis. */
    public boolean isDegrading() {
        return this != INCOMPLETE_EVIDENCE;
    }
}
