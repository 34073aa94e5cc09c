package com.merlt.orchestrator.expert;

import java.util.List;

/**
 * A tool an expert may call. Tools without relation types are semantic searches; the others
 * traverse the knowledge graph along the listed relations.
 */
public record ToolSpec(String name, String description, List<String> relationTypes) {

    public static final String SEMANTIC_SEARCH = "semantic_search";

    public ToolSpec {
        relationTypes = relationTypes == null ? List.of() : List.copyOf(relationTypes);
    }

    public static ToolSpec semanticSearch() {
        return new ToolSpec(SEMANTIC_SEARCH,
                "search doctrine, case law and norm texts; argument is the search text", List.of());
    }

    public static ToolSpec traversal(String name, String description, String... relationTypes) {
        return new ToolSpec(name, description + "; argument is a norm or concept id", List.of(relationTypes));
    }

    public boolean isTraversal() {
        return !this.relationTypes.isEmpty();
    }
}
