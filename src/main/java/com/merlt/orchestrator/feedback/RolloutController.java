package com.merlt.orchestrator.feedback;

/**
 * Receives notice that a weight set has accumulated enough updates to be tried as a candidate.
 * Traffic splitting is decided by the implementation.
 */
public interface RolloutController {

    void candidateReady(String weightSetId);
}
