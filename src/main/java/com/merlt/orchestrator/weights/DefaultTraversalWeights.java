package com.merlt.orchestrator.weights;

import static com.merlt.orchestrator.weights.RelationTypes.*;

import com.merlt.orchestrator.model.ExpertType;
import java.util.HashMap;
import java.util.Map;

/**
 * Initial relation preferences per expert. Preferences are given on a 0.5 to 1.0 scale and
 * compressed into (0.5, 0.95] so that feedback can still move the strongest relations.
 */
public final class DefaultTraversalWeights {

    private DefaultTraversalWeights() {
    }

    public static TraversalWeights forExpert(ExpertType expert) {
        Map<String, Double> preferences = switch (expert) {
            case LITERAL -> Map.of(
                    CONTAINS, 1.0, REGULATES, 0.95, DEFINES, 0.95, REFERS_TO, 0.9,
                    MODIFIES, 0.85, REPEALS, 0.8, CITES, 0.75);
            case SYSTEMIC -> Map.of(
                    CONNECTED_TO, 1.0, MODIFIES, 0.95, REPEALS, 0.9, DEROGATES, 0.9,
                    REFERS_TO, 0.85, REGULATES, 0.8, CONTAINS, 0.75, CITES, 0.7);
            case PRINCIPLES -> Map.of(
                    IMPLEMENTS, 1.0, EXPRESSES_PRINCIPLE, 0.95, CONSTITUTIONAL_BASIS, 0.95, EU_SOURCE, 0.9,
                    PURPOSE, 0.85, PROTECTS, 0.8, REGULATES, 0.75);
            case PRECEDENT -> Map.of(
                    INTERPRETS, 1.0, APPLIES, 0.95, CITES, 0.9, CONFIRMS, 0.85, COMMENTS, 0.85,
                    OVERRULES, 0.8, CONFLICTS_WITH, 0.75, REGULATES, 0.7);
        };
        Map<String, Double> probabilities = new HashMap<>();
        preferences.forEach((relation, preference) -> probabilities.put(relation, compress(preference)));
        return TraversalWeights.fromProbabilities(probabilities);
    }

    static double compress(double preference) {
        double bounded = Math.max(0.0, Math.min(1.0, preference));
        return 0.5 + 0.45 * (bounded - 0.5) / 0.5;
    }
}
