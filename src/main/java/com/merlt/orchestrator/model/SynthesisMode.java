package com.merlt.orchestrator.model;

public enum SynthesisMode {
    CONVERGENT,
    DIVERGENT
}
