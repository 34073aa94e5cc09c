package com.merlt.orchestrator.model;

import java.util.List;

/**
 * Normalized query as produced by the upstream query-understanding stage.
 */
public record QueryContext(
        String queryText,
        List<String> entities,
        List<DetectedIntent> intents,
        double complexity,
        String temporalScope) {

    public QueryContext {
        queryText = queryText == null ? "" : queryText;
        entities = entities == null ? List.of() : List.copyOf(entities);
        intents = intents == null ? List.of() : List.copyOf(intents);
        complexity = Math.max(0.0, Math.min(1.0, complexity));
    }

    public static QueryContext of(String queryText, DetectedIntent... intents) {
        return new QueryContext(queryText, List.of(), List.of(intents), 0.5, null);
    }
}
