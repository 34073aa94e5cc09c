package com.merlt.orchestrator.expert;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Final structured answer of one expert as returned by the model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpertAnalysis(
        @JsonProperty("interpretation") String interpretation,
        @JsonProperty("rationale") Map<String, String> rationale,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("cited_sources") List<String> citedSources,
        @JsonProperty("limitations") List<String> limitations) {
}
