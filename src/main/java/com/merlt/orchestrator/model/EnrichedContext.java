package com.merlt.orchestrator.model;

import java.util.List;

/**
 * Concept and norm candidates mapped from the query before planning.
 */
public record EnrichedContext(List<KnowledgeCandidate> conceptCandidates, List<KnowledgeCandidate> normCandidates) {

    public EnrichedContext {
        conceptCandidates = conceptCandidates == null ? List.of() : List.copyOf(conceptCandidates);
        normCandidates = normCandidates == null ? List.of() : List.copyOf(normCandidates);
    }

    public static EnrichedContext empty() {
        return new EnrichedContext(List.of(), List.of());
    }
}
