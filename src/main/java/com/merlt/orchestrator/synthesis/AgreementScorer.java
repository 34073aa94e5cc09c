package com.merlt.orchestrator.synthesis;

import java.util.List;

/**
 * Similarity of two expert conclusions in [0, 1].
 */
public interface AgreementScorer {

    double agreement(String first, String second);

    /**
     * Symmetric matrix of pairwise agreements with ones on the diagonal.
     */
    default double[][] pairwise(List<String> texts) {
        int n = texts.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double a = clamp(agreement(texts.get(i), texts.get(j)));
                matrix[i][j] = a;
                matrix[j][i] = a;
            }
        }
        return matrix;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
