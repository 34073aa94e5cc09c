package com.merlt.orchestrator.weights;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable relation-type preferences of one expert. Values are stored as logits and exposed
 * through the logistic function, so every weight stays strictly inside (0, 1) however many
 * updates are applied. Unknown relation types have logit 0, i.e. weight 0.5.
 */
public final class TraversalWeights {
    static final double MAX_LOGIT = 6.0;

    private final Map<String, Double> logits;
    private final long version;

    private TraversalWeights(Map<String, Double> logits, long version) {
        this.logits = Collections.unmodifiableMap(logits);
        this.version = version;
    }

    public static TraversalWeights fromProbabilities(Map<String, Double> probabilities) {
        Map<String, Double> logits = new HashMap<>();
        probabilities.forEach((relation, p) -> logits.put(RelationTypes.normalize(relation), clampLogit(logit(p))));
        return new TraversalWeights(logits, 0L);
    }

    public double weight(String relationType) {
        Double logit = this.logits.get(RelationTypes.normalize(relationType));
        return sigmoid(logit == null ? 0.0 : logit);
    }

    public double logit(String relationType) {
        return this.logits.getOrDefault(RelationTypes.normalize(relationType), 0.0);
    }

    /**
     * Returns a new snapshot with {@code deltas} added to the logits of the named relations.
     */
    public TraversalWeights withLogitDeltas(Map<String, Double> deltas) {
        Map<String, Double> next = new HashMap<>(this.logits);
        deltas.forEach((relation, delta) -> {
            if (delta == null || !Double.isFinite(delta)) {
                return;
            }
            String key = RelationTypes.normalize(relation);
            next.put(key, clampLogit(next.getOrDefault(key, 0.0) + delta));
        });
        return new TraversalWeights(next, this.version + 1);
    }

    public Map<String, Double> asProbabilities() {
        Map<String, Double> result = new HashMap<>();
        this.logits.forEach((relation, logit) -> result.put(relation, sigmoid(logit)));
        return result;
    }

    public long version() {
        return this.version;
    }

    static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    static double logit(double p) {
        double bounded = Math.max(1e-6, Math.min(1.0 - 1e-6, p));
        return Math.log(bounded / (1.0 - bounded));
    }

    private static double clampLogit(double value) {
        return Math.max(-MAX_LOGIT, Math.min(MAX_LOGIT, value));
    }
}
