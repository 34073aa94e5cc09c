package com.merlt.orchestrator.feedback;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Counts applied updates per weight set and signals the rollout controller each time a set
 * crosses the threshold. The count restarts after every signal.
 */
@Component
public class RolloutCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RolloutCoordinator.class);
    public static final String GATING = "gating";
    public static final String TRAVERSAL_PREFIX = "traversal.";

    private final RolloutController controller;
    private final Map<String, Integer> counts = new ConcurrentHashMap<>();
    private final int threshold;

    public RolloutCoordinator(RolloutController controller,
                              @Value("${merlt.feedback.rollout-threshold:50}") int threshold) {
        this.controller = controller;
        this.threshold = Math.max(1, threshold);
    }

    /**
     * @return true if this update made the weight set a candidate
     */
    public boolean recordUpdate(String weightSetId) {
        boolean[] crossed = new boolean[1];
        this.counts.compute(weightSetId, (id, current) -> {
            int next = (current == null ? 0 : current) + 1;
            if (next >= this.threshold) {
                crossed[0] = true;
                return 0;
            }
            return next;
        });
        if (crossed[0]) {
            log.debug("Weight set '{}' crossed {} updates", weightSetId, this.threshold);
            this.controller.candidateReady(weightSetId);
        }
        return crossed[0];
    }

    public int pendingUpdates(String weightSetId) {
        return this.counts.getOrDefault(weightSetId, 0);
    }
}
