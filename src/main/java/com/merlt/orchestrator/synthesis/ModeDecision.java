package com.merlt.orchestrator.synthesis;

import com.merlt.orchestrator.model.SynthesisMode;

public record ModeDecision(SynthesisMode mode, double minAgreement, double meanAgreement) {
}
