package com.merlt.orchestrator.model;

import java.time.Instant;
import java.util.Map;

/**
 * A user's rating of one answer. {@code relationUsefulness} maps expert to relation type to
 * whether following that relation helped. {@code declaredAuthority} is an optional override
 * supplied by trusted callers.
 */
public record FeedbackRecord(
        String feedbackId,
        String traceId,
        String userId,
        int rating,
        Map<ExpertType, Boolean> expertCorrectness,
        Map<ExpertType, Map<String, Boolean>> relationUsefulness,
        Double declaredAuthority,
        Instant submittedAt) {

    public FeedbackRecord {
        expertCorrectness = expertCorrectness == null ? Map.of() : Map.copyOf(expertCorrectness);
        relationUsefulness = relationUsefulness == null ? Map.of() : Map.copyOf(relationUsefulness);
        submittedAt = submittedAt == null ? Instant.now() : submittedAt;
    }
}
