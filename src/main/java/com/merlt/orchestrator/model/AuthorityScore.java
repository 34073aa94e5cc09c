package com.merlt.orchestrator.model;

import java.util.Map;

public record AuthorityScore(String userId, double score, Map<String, Double> components) {

    public AuthorityScore {
        score = Math.max(0.0, Math.min(1.0, score));
        components = components == null ? Map.of() : Map.copyOf(components);
    }
}
