package com.merlt.orchestrator.model;

public record KnowledgeCandidate(String id, String label, double score) {
}
