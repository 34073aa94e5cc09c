package com.merlt.orchestrator.model;

import java.util.Locale;

public enum UserRole {
    CITIZEN(0.2),
    STUDENT(0.4),
    LAWYER(0.7),
    LEGAL_SCHOLAR(0.85),
    JUDGE(0.9);

    private final double baseWeight;

    UserRole(double baseWeight) {
        this.baseWeight = baseWeight;
    }

    public double baseWeight() {
        return this.baseWeight;
    }

    public static UserRole fromValue(String value) {
        if (value == null) {
            return CITIZEN;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "studente":
            case "student":
                return STUDENT;
            case "avvocato":
            case "lawyer":
                return LAWYER;
            case "accademico":
            case "legal_scholar":
            case "scholar":
                return LEGAL_SCHOLAR;
            case "giudice":
            case "judge":
            case "magistrato":
                return JUDGE;
            default:
                return CITIZEN;
        }
    }
}
