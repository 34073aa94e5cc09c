package com.merlt.orchestrator.retrieval;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface KnowledgeRetrievalClient {

    /**
     * Semantic search over the chunk store, best first.
     *
     * @param filters metadata equality filters, may be empty
     */
    List<RetrievedChunk> search(String query, Map<String, String> filters, int topK);

    /**
     * Follows edges of the given relation types from {@code startNode} and ranks the neighbours by
     * edge score times {@code relationWeights.get(type)} (0.5 for types absent from the map).
     */
    List<RelatedNode> traverse(String startNode, Collection<String> relationTypes, Map<String, Double> relationWeights);
}
