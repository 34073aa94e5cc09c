package com.merlt.orchestrator.model;

/**
 * One retrieved item. {@code relationType} is null for plain semantic-search hits.
 */
public record Evidence(
        String sourceId,
        String text,
        String relationType,
        double rawScore,
        double weightedScore,
        String tool) {
}
