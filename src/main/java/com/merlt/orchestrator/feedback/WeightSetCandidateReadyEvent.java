package com.merlt.orchestrator.feedback;

import java.time.Instant;

public record WeightSetCandidateReadyEvent(String weightSetId, int updates, Instant readyAt) {
}
