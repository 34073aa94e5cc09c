package com.merlt.orchestrator.router;

import com.merlt.orchestrator.exception.MaxRetriesExceededException;
import com.merlt.orchestrator.model.EnrichedContext;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.QueryContext;
import com.merlt.orchestrator.reasoning.ReasoningStep;
import com.merlt.orchestrator.reasoning.ReasoningTrace;
import com.merlt.orchestrator.reasoning.ReasoningTracer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * GENERATE, VALIDATE, then DONE or back to GENERATE, until the attempt budget is spent. The loop
 * is strictly sequential since every attempt sees the reasons the previous ones were rejected.
 */
@Service
public class ExecutionPlanRouter {
    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanRouter.class);

    private final PlanGenerator generator;
    private final PlanValidator validator;
    private final ReasoningTracer tracer;
    @Value("${merlt.router.max-retries:3}")
    private int maxRetries = 3;

    public ExecutionPlanRouter(PlanGenerator generator, PlanValidator validator, ReasoningTracer tracer) {
        this.generator = generator;
        this.validator = validator;
        this.tracer = tracer;
    }

    public ExecutionPlan route(QueryContext query, EnrichedContext enriched, ReasoningTrace trace) {
        return route(query, enriched, null, trace);
    }

    /**
     * @return a plan that passed validation
     * @throws MaxRetriesExceededException when {@code max-retries} attempts were all rejected
     */
    public ExecutionPlan route(QueryContext query, EnrichedContext enriched, String refinementNote, ReasoningTrace trace) {
        String traceId = trace == null ? null : trace.getTraceId();
        int budget = Math.max(1, this.maxRetries);
        List<String> rejections = new ArrayList<>();
        int retryCount = 0;
        RouterState state = RouterState.GENERATE;
        ExecutionPlan candidate = null;
        while (state != RouterState.DONE && state != RouterState.REJECTED) {
            switch (state) {
                case GENERATE -> {
                    long start = System.currentTimeMillis();
                    candidate = this.generator.generate(query, enriched, retryCount, rejections, refinementNote, traceId);
                    this.tracer.addStep(trace, ReasoningStep.StepType.PLAN_GENERATION, "Plan attempt " + candidate.attempt(),
                            "experts=" + candidate.experts(), System.currentTimeMillis() - start,
                            Map.of("agents", candidate.retrievalAgents().toString(), "experts", candidate.experts().toString()));
                    state = RouterState.VALIDATE;
                }
                case VALIDATE -> {
                    PlanValidation validation = this.validator.validate(candidate, query);
                    if (validation.valid()) {
                        this.tracer.addStep(trace, ReasoningStep.StepType.PLAN_VALIDATION, "Plan accepted",
                                candidate.rationale(), 0L);
                        state = RouterState.DONE;
                    }
                    else {
                        retryCount++;
                        rejections.add(validation.reason());
                        this.tracer.addStep(trace, ReasoningStep.StepType.PLAN_VALIDATION, "Plan rejected",
                                validation.reason(), 0L, Map.of("retryCount", retryCount));
                        log.info("Trace {} plan attempt {} rejected: {}", traceId, retryCount, validation.reason());
                        state = retryCount >= budget ? RouterState.REJECTED : RouterState.GENERATE;
                    }
                }
                default -> throw new IllegalStateException("Unexpected router state " + state);
            }
        }
        if (state == RouterState.REJECTED) {
            this.tracer.addMetric(trace, "planRetries", retryCount);
            throw new MaxRetriesExceededException(retryCount, rejections, traceId);
        }
        this.tracer.addMetric(trace, "planRetries", retryCount);
        return candidate;
    }

    public int getMaxRetries() {
        return this.maxRetries;
    }
}
