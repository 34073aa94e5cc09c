package com.merlt.orchestrator.router;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Raw plan as returned by the model, before identifiers are resolved.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDraft(
        @JsonProperty("retrieval_agents") Map<String, Boolean> retrievalAgents,
        @JsonProperty("experts") List<String> experts,
        @JsonProperty("max_iterations") Integer maxIterations,
        @JsonProperty("min_confidence") Double minConfidence,
        @JsonProperty("rationale") String rationale) {
}
