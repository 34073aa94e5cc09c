package com.merlt.orchestrator.feedback;

/**
 * Durable record of feedback ids whose updates were applied.
 */
public interface ProcessedFeedbackLedger {

    boolean hasProcessed(String feedbackId);

    /**
     * @return false if the id was already recorded
     */
    boolean markProcessed(String feedbackId);
}
