package com.merlt.orchestrator.model;

public record ExpertContribution(ExpertType expert, double weight, double confidence, String interpretation) {
}
