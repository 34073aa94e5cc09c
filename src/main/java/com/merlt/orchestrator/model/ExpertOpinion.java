package com.merlt.orchestrator.model;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record ExpertOpinion(
        ExpertType expert,
        String interpretation,
        Map<String, String> rationale,
        double confidence,
        List<String> citedSources,
        List<String> limitations,
        Set<OpinionFlag> flags,
        List<Evidence> evidence,
        int toolRounds,
        long durationMs) {

    public ExpertOpinion {
        interpretation = interpretation == null ? "" : interpretation;
        rationale = rationale == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(rationale));
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        citedSources = citedSources == null ? List.of() : List.copyOf(citedSources);
        limitations = limitations == null ? List.of() : List.copyOf(limitations);
        flags = flags == null || flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /**
     * Opinion standing in for an expert that did not finish. Confidence is always zero and the
     * flag label is recorded as a limitation.
     */
    public static ExpertOpinion degraded(ExpertType expert, OpinionFlag flag, String detail, long durationMs) {
        String limitation = detail == null || detail.isBlank() ? flag.label() : flag.label() + ": " + detail;
        return new ExpertOpinion(expert, "", Map.of(), 0.0, List.of(),
                List.of(limitation), EnumSet.of(flag), List.of(), 0, durationMs);
    }

    public boolean hasFlag(OpinionFlag flag) {
        return this.flags.contains(flag);
    }

    public boolean hasLimitation(String label) {
        return this.limitations.stream().anyMatch(l -> l.equals(label) || l.startsWith(label + ":"));
    }

    public boolean usable() {
        return this.flags.stream().noneMatch(OpinionFlag::isDegrading) && !this.interpretation.isBlank();
    }
}
