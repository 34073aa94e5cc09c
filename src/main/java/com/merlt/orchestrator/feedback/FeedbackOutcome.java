package com.merlt.orchestrator.feedback;

public record FeedbackOutcome(
        boolean accepted,
        FeedbackRejection rejection,
        String detail,
        double authority,
        boolean gatingUpdated,
        int traversalUpdates) {

    public static FeedbackOutcome accepted(double authority, boolean gatingUpdated, int traversalUpdates) {
        return new FeedbackOutcome(true, null, null, authority, gatingUpdated, traversalUpdates);
    }

    public static FeedbackOutcome rejected(FeedbackRejection rejection, String detail) {
        return new FeedbackOutcome(false, rejection, detail, 0.0, false, 0);
    }
}
