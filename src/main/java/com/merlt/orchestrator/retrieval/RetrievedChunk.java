package com.merlt.orchestrator.retrieval;

import java.util.Map;

public record RetrievedChunk(String id, String text, double score, Map<String, Object> metadata) {

    public RetrievedChunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
