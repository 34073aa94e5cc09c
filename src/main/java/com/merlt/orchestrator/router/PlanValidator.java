package com.merlt.orchestrator.router;

import com.merlt.orchestrator.model.DetectedIntent;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.QueryContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Structural and intent-consistency checks on a candidate plan. The first violated rule is
 * reported; its text goes back to the model verbatim.
 */
@Component
public class PlanValidator {
    private static final Logger log = LoggerFactory.getLogger(PlanValidator.class);

    private final Map<String, ExpertType> intentRequirements;
    private final double intentConfidenceThreshold;

    public PlanValidator(
            @Value("${merlt.router.intent-requirements:bilanciamento_diritti=PRINCIPLES,precedent_search=PRECEDENT,norm_explanation=LITERAL,validità_atto=LITERAL}") String intentRequirements,
            @Value("${merlt.router.intent-confidence-threshold:0.5}") double intentConfidenceThreshold) {
        this.intentRequirements = parseRequirements(intentRequirements);
        this.intentConfidenceThreshold = intentConfidenceThreshold;
    }

    public PlanValidation validate(ExecutionPlan plan, QueryContext query) {
        if (plan == null) {
            return PlanValidation.invalid("no plan was produced");
        }
        if (plan.retrievalAgents().isEmpty()) {
            return PlanValidation.invalid("at least one retrieval agent must be enabled");
        }
        if (!plan.unknownExperts().isEmpty()) {
            return PlanValidation.invalid("unknown expert identifiers " + plan.unknownExperts()
                    + "; use literal, systemic, principles or precedent");
        }
        if (plan.experts().isEmpty()) {
            return PlanValidation.invalid("at least one expert must be selected");
        }
        if (plan.stopCriteria().maxIterations() < 1) {
            return PlanValidation.invalid("max_iterations must be at least 1");
        }
        double minConfidence = plan.stopCriteria().minConfidence();
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            return PlanValidation.invalid("min_confidence must be between 0 and 1");
        }
        if (query != null) {
            for (DetectedIntent intent : query.intents()) {
                ExpertType required = this.intentRequirements.get(intent.name().toLowerCase(Locale.ROOT));
                if (required != null && intent.confidence() >= this.intentConfidenceThreshold && !plan.selects(required)) {
                    log.debug("Plan attempt {} misses {} required by intent {}", plan.attempt(), required, intent.name());
                    return PlanValidation.invalid("intent '" + intent.name() + "' requires the "
                            + required.id() + " expert");
                }
            }
        }
        return PlanValidation.ok();
    }

    public Map<String, ExpertType> getIntentRequirements() {
        return this.intentRequirements;
    }

    static Map<String, ExpertType> parseRequirements(String mapping) {
        Map<String, ExpertType> requirements = new LinkedHashMap<>();
        if (mapping == null || mapping.isBlank()) {
            return Collections.unmodifiableMap(requirements);
        }
        for (String pair : mapping.split(",")) {
            String[] parts = pair.split("=", 2);
            if (parts.length != 2) {
                log.warn("Ignoring malformed intent requirement '{}'", pair);
                continue;
            }
            String intent = parts[0].trim().toLowerCase(Locale.ROOT);
            ExpertType.fromId(parts[1]).ifPresentOrElse(
                    expert -> requirements.put(intent, expert),
                    () -> log.warn("Ignoring intent requirement with unknown expert '{}'", pair));
        }
        return Collections.unmodifiableMap(requirements);
    }
}
