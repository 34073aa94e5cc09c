package com.merlt.orchestrator.model;

public record DetectedIntent(String name, double confidence) {
    public DetectedIntent {
        name = name == null ? "unknown" : name.trim();
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
