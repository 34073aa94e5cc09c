package com.merlt.orchestrator.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Which retrieval agents and experts a request activates. Identifiers the model produced
 * that map to no known expert are kept in {@code unknownExperts} so validation can reject them.
 */
public record ExecutionPlan(
        Set<RetrievalAgent> retrievalAgents,
        List<ExpertType> experts,
        List<String> unknownExperts,
        StopCriteria stopCriteria,
        String rationale,
        int attempt) {

    public ExecutionPlan {
        retrievalAgents = retrievalAgents == null || retrievalAgents.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(retrievalAgents));
        experts = experts == null ? List.of() : List.copyOf(experts);
        unknownExperts = unknownExperts == null ? List.of() : List.copyOf(unknownExperts);
        stopCriteria = stopCriteria == null ? StopCriteria.defaults() : stopCriteria;
        rationale = rationale == null ? "" : rationale;
    }

    public boolean isAgentEnabled(RetrievalAgent agent) {
        return this.retrievalAgents.contains(agent);
    }

    public boolean selects(ExpertType expert) {
        return this.experts.contains(expert);
    }
}
