package com.merlt.orchestrator.retrieval;

import com.merlt.orchestrator.util.LogSanitizer;
import com.merlt.orchestrator.weights.RelationTypes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/**
 * Chunk search through the Spring AI vector store and graph traversal over an edge collection in
 * MongoDB. Edge documents carry {@code source}, {@code target}, {@code type}, {@code text} and an
 * optional {@code score}.
 */
@Service
public class SpringAiKnowledgeRetrievalClient implements KnowledgeRetrievalClient {
    private static final Logger log = LoggerFactory.getLogger(SpringAiKnowledgeRetrievalClient.class);
    private static final int MAX_EDGES = 200;

    private final VectorStore vectorStore;
    private final MongoTemplate mongoTemplate;
    @Value("${merlt.retrieval.relations-collection:legal_relations}")
    private String relationsCollection = "legal_relations";
    @Value("${merlt.retrieval.similarity-threshold:0.3}")
    private double similarityThreshold = 0.3;

    public SpringAiKnowledgeRetrievalClient(VectorStore vectorStore, MongoTemplate mongoTemplate) {
        this.vectorStore = vectorStore;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<RetrievedChunk> search(String query, Map<String, String> filters, int topK) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        SearchRequest.Builder request = SearchRequest.builder()
                .query(query)
                .topK(Math.max(1, topK))
                .similarityThreshold(this.similarityThreshold);
        if (filters != null && !filters.isEmpty()) {
            request.filterExpression(filters.entrySet().stream()
                    .map(e -> e.getKey() + " == '" + e.getValue().replace("'", "") + "'")
                    .collect(Collectors.joining(" && ")));
        }
        List<Document> documents = this.vectorStore.similaritySearch(request.build());
        if (documents == null) {
            return List.of();
        }
        List<RetrievedChunk> chunks = new ArrayList<>();
        for (Document doc : documents) {
            double score = doc.getScore() != null ? doc.getScore() : 0.0;
            chunks.add(new RetrievedChunk(doc.getId(), doc.getText(), score, doc.getMetadata()));
        }
        log.debug("Semantic search {} returned {} chunks", LogSanitizer.querySummary(query), chunks.size());
        return chunks;
    }

    @Override
    public List<RelatedNode> traverse(String startNode, Collection<String> relationTypes, Map<String, Double> relationWeights) {
        if (startNode == null || startNode.isBlank()) {
            return List.of();
        }
        Query query = new Query(Criteria.where("source").is(startNode));
        if (relationTypes != null && !relationTypes.isEmpty()) {
            query.addCriteria(Criteria.where("type").in(relationTypes.stream().map(RelationTypes::normalize).toList()));
        }
        query.limit(MAX_EDGES);
        List<Map> edges = this.mongoTemplate.find(query, Map.class, this.relationsCollection);
        List<RelatedNode> nodes = new ArrayList<>();
        for (Map edge : edges) {
            Object target = edge.get("target");
            if (target == null) {
                continue;
            }
            String type = RelationTypes.normalize(String.valueOf(edge.get("type")));
            double raw = edge.get("score") instanceof Number n ? n.doubleValue() : 1.0;
            double weight = relationWeights == null ? 0.5 : relationWeights.getOrDefault(type, 0.5);
            Object text = edge.get("text");
            nodes.add(new RelatedNode(String.valueOf(target), text == null ? "" : String.valueOf(text), type, raw, raw * weight));
        }
        nodes.sort(Comparator.comparingDouble(RelatedNode::weightedScore).reversed());
        log.debug("Traversal from {} over {} returned {} nodes", LogSanitizer.sanitize(startNode), relationTypes, nodes.size());
        return nodes;
    }
}
