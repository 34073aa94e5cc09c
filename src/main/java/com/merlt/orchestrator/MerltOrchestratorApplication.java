package com.merlt.orchestrator;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.mongodb.atlas.MongoDBAtlasVectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

@SpringBootApplication
public class MerltOrchestratorApplication {
    private static final Logger log = LoggerFactory.getLogger(MerltOrchestratorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MerltOrchestratorApplication.class, args);
    }

    @Bean
    public VectorStore vectorStore(MongoTemplate mongoTemplate, EmbeddingModel embeddingModel,
                                   @Value("${merlt.vectorstore.collection:legal_chunks}") String collection,
                                   @Value("${merlt.vectorstore.index:vector_index}") String index,
                                   @Value("${merlt.vectorstore.path:embedding}") String path) {
        log.info("Using MongoDB vector store collection '{}' (index '{}')", collection, index);
        return MongoDBAtlasVectorStore.builder(mongoTemplate, embeddingModel)
                .collectionName(collection)
                .vectorIndexName(index)
                .pathName(path)
                .metadataFieldsToFilter(List.of("source_type", "norm_id", "court"))
                .initializeSchema(false)
                .build();
    }
}
