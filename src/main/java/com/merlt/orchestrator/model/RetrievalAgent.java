package com.merlt.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

public enum RetrievalAgent {
    KNOWLEDGE_GRAPH("kg_agent"),
    NORM_API("api_agent"),
    VECTOR_DB("vectordb_agent");

    private final String id;

    RetrievalAgent(String id) {
        this.id = id;
    }

    public String id() {
        return this.id;
    }

    public static Optional<RetrievalAgent> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RetrievalAgent agent : values()) {
            if (agent.id.equals(normalized) || agent.name().equalsIgnoreCase(normalized)) {
                return Optional.of(agent);
            }
        }
        return Optional.empty();
    }
}
