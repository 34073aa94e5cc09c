package com.merlt.orchestrator.retrieval;

/**
 * A node reached by following one edge. {@code weightedScore} is the edge score times the
 * caller's weight for {@code relationType}.
 */
public record RelatedNode(String id, String text, String relationType, double rawScore, double weightedScore) {
}
