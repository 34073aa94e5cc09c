package com.merlt.orchestrator.synthesis;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

/**
 * Cosine similarity of conclusion embeddings, clamped to [0, 1]. Falls back to lexical overlap when
 * the embedding call fails.
 */
@Component
public class EmbeddingAgreementScorer implements AgreementScorer {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingAgreementScorer.class);

    private final EmbeddingModel embeddingModel;
    private final LexicalAgreementScorer fallback = new LexicalAgreementScorer();

    public EmbeddingAgreementScorer(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public double agreement(String first, String second) {
        return pairwise(List.of(first == null ? "" : first, second == null ? "" : second))[0][1];
    }

    @Override
    public double[][] pairwise(List<String> texts) {
        if (texts.size() < 2) {
            return AgreementScorer.super.pairwise(texts);
        }
        List<float[]> vectors;
        try {
            vectors = this.embeddingModel.embed(texts);
        }
        catch (RuntimeException e) {
            log.warn("Embedding agreement failed, using lexical overlap: {}", e.getMessage());
            return this.fallback.pairwise(texts);
        }
        if (vectors == null || vectors.size() != texts.size()) {
            log.warn("Embedding model returned {} vectors for {} texts, using lexical overlap",
                    vectors == null ? 0 : vectors.size(), texts.size());
            return this.fallback.pairwise(texts);
        }
        int n = texts.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double a = AgreementScorer.clamp(cosine(vectors.get(i), vectors.get(j)));
                matrix[i][j] = a;
                matrix[j][i] = a;
            }
        }
        return matrix;
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
