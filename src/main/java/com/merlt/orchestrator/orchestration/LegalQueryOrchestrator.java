package com.merlt.orchestrator.orchestration;

import com.merlt.orchestrator.exception.OrchestrationException;
import com.merlt.orchestrator.exception.PipelineStage;
import com.merlt.orchestrator.exception.RequestCancelledException;
import com.merlt.orchestrator.expert.ExpertDispatcher;
import com.merlt.orchestrator.feedback.AnswerFeatureStore;
import com.merlt.orchestrator.feedback.AnswerFeatures;
import com.merlt.orchestrator.feedback.FeedbackOutcome;
import com.merlt.orchestrator.feedback.FeedbackProcessor;
import com.merlt.orchestrator.gating.GatingNetwork;
import com.merlt.orchestrator.model.EnrichedContext;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.ExpertOpinion;
import com.merlt.orchestrator.model.FeedbackRecord;
import com.merlt.orchestrator.model.GatingWeights;
import com.merlt.orchestrator.model.QueryContext;
import com.merlt.orchestrator.model.SynthesizedAnswer;
import com.merlt.orchestrator.reasoning.ReasoningStep;
import com.merlt.orchestrator.reasoning.ReasoningTrace;
import com.merlt.orchestrator.reasoning.ReasoningTracer;
import com.merlt.orchestrator.retrieval.QueryEncoder;
import com.merlt.orchestrator.router.ExecutionPlanRouter;
import com.merlt.orchestrator.synthesis.Synthesizer;
import com.merlt.orchestrator.util.CancellationToken;
import com.merlt.orchestrator.util.LogSanitizer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Entry point for answering a legal query and for rating the answer afterwards.
 *
 * <p>A query is planned, routed, handed to the selected experts in parallel and synthesized.
 * When the answer's confidence stays below the plan's minimum and the plan allows more
 * iterations, the router is asked for a refined plan and the best answer is kept.</p>
 */
@Service
public class LegalQueryOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LegalQueryOrchestrator.class);

    private final ExecutionPlanRouter router;
    private final QueryEncoder queryEncoder;
    private final GatingNetwork gatingNetwork;
    private final ExpertDispatcher dispatcher;
    private final Synthesizer synthesizer;
    private final FeedbackProcessor feedbackProcessor;
    private final AnswerFeatureStore answerFeatures;
    private final ReasoningTracer tracer;
    @Value("${merlt.orchestrator.max-iterations:3}")
    private int maxIterations = 3;

    public LegalQueryOrchestrator(ExecutionPlanRouter router, QueryEncoder queryEncoder, GatingNetwork gatingNetwork,
                                  ExpertDispatcher dispatcher, Synthesizer synthesizer,
                                  FeedbackProcessor feedbackProcessor, AnswerFeatureStore answerFeatures,
                                  ReasoningTracer tracer) {
        this.router = router;
        this.queryEncoder = queryEncoder;
        this.gatingNetwork = gatingNetwork;
        this.dispatcher = dispatcher;
        this.synthesizer = synthesizer;
        this.feedbackProcessor = feedbackProcessor;
        this.answerFeatures = answerFeatures;
        this.tracer = tracer;
    }

    public SynthesizedAnswer handleQuery(QueryContext query, EnrichedContext enriched) {
        return handleQuery(query, enriched, CancellationToken.none());
    }

    /**
     * @throws OrchestrationException when no plan validates, the model is unreachable, no expert
     *         produced usable evidence, or {@code cancellation} fired
     */
    public SynthesizedAnswer handleQuery(QueryContext query, EnrichedContext enriched, CancellationToken cancellation) {
        EnrichedContext context = enriched == null ? EnrichedContext.empty() : enriched;
        CancellationToken token = cancellation == null ? CancellationToken.none() : cancellation;
        ReasoningTrace trace = this.tracer.startTrace(query.queryText());
        String traceId = trace.getTraceId();
        log.info("Trace {} started for query {}", traceId, LogSanitizer.querySummary(query.queryText()));
        try {
            float[] embedding = encode(query, trace);
            GatingWeights gating = this.gatingNetwork.route(embedding, query.intents());
            this.tracer.addStep(trace, ReasoningStep.StepType.GATING, "Gating weights", gating.weights().toString(), 0L,
                    Map.of("version", gating.version()));

            SynthesizedAnswer best = null;
            String refinementNote = null;
            int iteration = 0;
            int allowed = 1;
            while (iteration < allowed) {
                checkCancelled(token, PipelineStage.PLAN_GENERATION, traceId);
                iteration++;
                ExecutionPlan plan;
                SynthesizedAnswer answer;
                try {
                    plan = this.router.route(query, context, refinementNote, trace);
                    allowed = Math.max(1, Math.min(this.maxIterations, plan.stopCriteria().maxIterations()));
                    List<ExpertOpinion> opinions = this.dispatcher.dispatch(plan, query, context, token, trace);
                    answer = this.tracer.timed(trace, ReasoningStep.StepType.SYNTHESIS, "Synthesis",
                            () -> this.synthesizer.synthesize(opinions, gating, traceId)).withContext(traceId, plan, iteration);
                }
                catch (OrchestrationException e) {
                    if (best == null || e instanceof RequestCancelledException) {
                        throw e;
                    }
                    log.warn("Trace {} refinement iteration {} failed at {}; keeping the earlier answer",
                            traceId, iteration, e.getStage());
                    break;
                }
                if (best == null || answer.confidence() > best.confidence()) {
                    best = answer;
                }
                if (answer.confidence() >= plan.stopCriteria().minConfidence()) {
                    break;
                }
                refinementNote = String.format(Locale.ROOT,
                        "the previous plan (experts %s) reached confidence %.2f, below the required %.2f; "
                                + "select experts or retrieval agents that can close the gap",
                        plan.experts(), answer.confidence(), plan.stopCriteria().minConfidence());
                if (iteration < allowed) {
                    this.tracer.addStep(trace, ReasoningStep.StepType.REFINEMENT, "Refining plan", refinementNote, 0L);
                }
            }
            this.answerFeatures.put(new AnswerFeatures(traceId, embedding, best.plan().experts(), gating.version()));
            this.tracer.addMetric(trace, "mode", best.mode().name());
            this.tracer.addMetric(trace, "confidence", best.confidence());
            this.tracer.addMetric(trace, "iterations", best.iterations());
            log.info("Trace {} answered: mode={}, confidence={}, iterations={}", traceId, best.mode(),
                    String.format(Locale.ROOT, "%.2f", best.confidence()), iteration);
            return best;
        }
        catch (OrchestrationException e) {
            this.tracer.addStep(trace, ReasoningStep.StepType.ERROR, e.getClass().getSimpleName(), e.getMessage(), 0L,
                    Map.of("stage", e.getStage().name(), "retryCount", e.getRetryCount()));
            log.error("Trace {} failed at stage {} (retryCount={}): {}", traceId, e.getStage(), e.getRetryCount(), e.getMessage());
            throw e;
        }
        finally {
            this.tracer.endTrace(trace);
        }
    }

    /**
     * Feedback never fails the caller; problems come back as a rejected outcome.
     */
    public FeedbackOutcome handleFeedback(FeedbackRecord record) {
        return this.feedbackProcessor.ingest(record);
    }

    public ReasoningTrace getTrace(String traceId) {
        return this.tracer.getTrace(traceId);
    }

    private float[] encode(QueryContext query, ReasoningTrace trace) {
        long start = System.currentTimeMillis();
        try {
            float[] embedding = this.queryEncoder.encode(query.queryText());
            this.tracer.addStep(trace, ReasoningStep.StepType.QUERY_ENCODING, "Query encoded",
                    "dim=" + (embedding == null ? 0 : embedding.length), System.currentTimeMillis() - start);
            return embedding;
        }
        catch (RuntimeException e) {
            log.warn("Trace {} query encoding failed, routing on priors: {}", trace.getTraceId(), e.getMessage());
            this.tracer.addStep(trace, ReasoningStep.StepType.ERROR, "Query encoding failed",
                    LogSanitizer.sanitize(e.getMessage()), System.currentTimeMillis() - start);
            return new float[0];
        }
    }

    private static void checkCancelled(CancellationToken token, PipelineStage stage, String traceId) {
        if (token.shouldStop()) {
            throw new RequestCancelledException("Request cancelled before " + stage.name().toLowerCase(Locale.ROOT),
                    stage, traceId);
        }
    }
}
