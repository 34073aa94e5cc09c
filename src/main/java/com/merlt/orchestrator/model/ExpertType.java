package com.merlt.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The four reasoning experts. Declaration order is the layering order used when a
 * convergent answer is composed (textual base first, case law last).
 */
public enum ExpertType {
    LITERAL("literal"),
    SYSTEMIC("systemic"),
    PRINCIPLES("principles"),
    PRECEDENT("precedent");

    private final String id;

    ExpertType(String id) {
        this.id = id;
    }

    public String id() {
        return this.id;
    }

    public static Optional<ExpertType> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExpertType type : values()) {
            if (type.id.equals(normalized) || type.name().equalsIgnoreCase(normalized)
                    || (type.id + "_expert").equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
