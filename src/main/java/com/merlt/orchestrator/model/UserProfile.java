package com.merlt.orchestrator.model;

/**
 * Inputs to authority scoring. Accuracy, consensus and reputation are all in [0, 1].
 */
public record UserProfile(
        String userId,
        UserRole role,
        double historicalAccuracy,
        double consensusRate,
        double reputation) {

    public UserProfile {
        role = role == null ? UserRole.CITIZEN : role;
        historicalAccuracy = clamp(historicalAccuracy);
        consensusRate = clamp(consensusRate);
        reputation = clamp(reputation);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
