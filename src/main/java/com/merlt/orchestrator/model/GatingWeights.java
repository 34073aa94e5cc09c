package com.merlt.orchestrator.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;

/**
 * Probability distribution over the experts, tagged with the parameter version it came from.
 */
public record GatingWeights(Map<ExpertType, Double> weights, long version) {

    public GatingWeights {
        EnumMap<ExpertType, Double> copy = new EnumMap<>(ExpertType.class);
        for (ExpertType type : ExpertType.values()) {
            Double w = weights == null ? null : weights.get(type);
            copy.put(type, w == null ? 0.0 : w);
        }
        weights = Map.copyOf(copy);
    }

    public static GatingWeights uniform() {
        EnumMap<ExpertType, Double> map = new EnumMap<>(ExpertType.class);
        for (ExpertType type : ExpertType.values()) {
            map.put(type, 1.0 / ExpertType.values().length);
        }
        return new GatingWeights(map, 0L);
    }

    public double weight(ExpertType expert) {
        return this.weights.getOrDefault(expert, 0.0);
    }

    /**
     * Restricts the distribution to the given experts and rescales it to sum to one. Falls back to
     * a uniform split when the restricted mass is zero.
     */
    public Map<ExpertType, Double> renormalizedOver(Collection<ExpertType> experts) {
        EnumMap<ExpertType, Double> result = new EnumMap<>(ExpertType.class);
        if (experts == null || experts.isEmpty()) {
            return result;
        }
        double mass = 0.0;
        for (ExpertType expert : experts) {
            mass += weight(expert);
        }
        for (ExpertType expert : experts) {
            result.put(expert, mass > 0.0 ? weight(expert) / mass : 1.0 / experts.size());
        }
        return result;
    }

    public ExpertType favoured() {
        return this.weights.entrySet().stream()
                .max(Comparator.<Map.Entry<ExpertType, Double>>comparingDouble(Map.Entry::getValue)
                        .thenComparing(e -> -e.getKey().ordinal()))
                .map(Map.Entry::getKey)
                .orElse(ExpertType.LITERAL);
    }
}
