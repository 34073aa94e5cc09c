package com.merlt.orchestrator.gating;

import com.merlt.orchestrator.model.ExpertType;

/**
 * Immutable snapshot of the gate: one weight row and one bias per expert. Arrays are copied in and
 * never handed out, so a published snapshot can be read without locking.
 */
final class GatingParameters {
    private final double[][] weights;
    private final double[] bias;
    private final long version;

    GatingParameters(double[][] weights, double[] bias, long version) {
        this.weights = new double[weights.length][];
        for (int k = 0; k < weights.length; k++) {
            this.weights[k] = weights[k].clone();
        }
        this.bias = bias.clone();
        this.version = version;
    }

    static GatingParameters initial(int inputDim, double[] priors) {
        int experts = ExpertType.values().length;
        double[] bias = new double[experts];
        for (int k = 0; k < experts; k++) {
            bias[k] = Math.log(Math.max(1e-6, priors[k]));
        }
        return new GatingParameters(new double[experts][inputDim], bias, 0L);
    }

    int inputDim() {
        return this.weights.length == 0 ? 0 : this.weights[0].length;
    }

    long version() {
        return this.version;
    }

    double[] logits(float[] x) {
        double[] z = this.bias.clone();
        if (x == null) {
            return z;
        }
        for (int k = 0; k < z.length; k++) {
            double dot = 0.0;
            double[] row = this.weights[k];
            for (int j = 0; j < row.length; j++) {
                dot += row[j] * x[j];
            }
            z[k] += dot;
        }
        return z;
    }

    double[][] copyWeights() {
        double[][] copy = new double[this.weights.length][];
        for (int k = 0; k < this.weights.length; k++) {
            copy[k] = this.weights[k].clone();
        }
        return copy;
    }

    double[] copyBias() {
        return this.bias.clone();
    }
}
