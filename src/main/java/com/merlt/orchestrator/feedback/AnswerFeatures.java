package com.merlt.orchestrator.feedback;

import com.merlt.orchestrator.model.ExpertType;
import java.util.List;

/**
 * What feedback on an answer needs to know about the request that produced it.
 */
public record AnswerFeatures(String traceId, float[] queryEmbedding, List<ExpertType> experts, long gatingVersion) {

    public AnswerFeatures {
        queryEmbedding = queryEmbedding == null ? new float[0] : queryEmbedding.clone();
        experts = experts == null ? List.of() : List.copyOf(experts);
    }
}
