package com.merlt.orchestrator.retrieval;

/**
 * Maps text to the embedding the gate routes on.
 */
public interface QueryEncoder {

    float[] encode(String text);
}
