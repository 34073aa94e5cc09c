package com.merlt.orchestrator.weights;

import com.merlt.orchestrator.model.ExpertType;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Four independent copy-on-write partitions, one per expert. Readers take a snapshot and keep
 * using it for the rest of their run; writers publish a whole new snapshot.
 */
@Component
public class TraversalWeightStore {
    private static final Logger log = LoggerFactory.getLogger(TraversalWeightStore.class);

    private final Map<ExpertType, AtomicReference<TraversalWeights>> partitions = new EnumMap<>(ExpertType.class);

    public TraversalWeightStore() {
        for (ExpertType expert : ExpertType.values()) {
            this.partitions.put(expert, new AtomicReference<>(DefaultTraversalWeights.forExpert(expert)));
        }
    }

    public TraversalWeights snapshot(ExpertType expert) {
        return this.partitions.get(expert).get();
    }

    public TraversalWeights applyLogitDeltas(ExpertType expert, Map<String, Double> deltas) {
        if (deltas == null || deltas.isEmpty()) {
            return snapshot(expert);
        }
        TraversalWeights updated = this.partitions.get(expert).updateAndGet(current -> current.withLogitDeltas(deltas));
        log.debug("Traversal weights for {} updated to version {} ({} relations)", expert.id(), updated.version(), deltas.size());
        return updated;
    }

    public void reset(ExpertType expert) {
        this.partitions.get(expert).set(DefaultTraversalWeights.forExpert(expert));
    }
}
