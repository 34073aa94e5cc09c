package com.merlt.orchestrator.retrieval;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingQueryEncoder implements QueryEncoder {
    private final EmbeddingModel embeddingModel;

    public EmbeddingQueryEncoder(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] encode(String text) {
        return this.embeddingModel.embed(text == null ? "" : text);
    }
}
