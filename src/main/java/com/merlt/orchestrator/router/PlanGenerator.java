package com.merlt.orchestrator.router;

import com.merlt.orchestrator.exception.PlanGenerationFailedException;
import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.llm.LanguageModelUnavailableException;
import com.merlt.orchestrator.model.DetectedIntent;
import com.merlt.orchestrator.model.EnrichedContext;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.KnowledgeCandidate;
import com.merlt.orchestrator.model.QueryContext;
import com.merlt.orchestrator.model.RetrievalAgent;
import com.merlt.orchestrator.model.StopCriteria;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Asks the reasoning model for an execution plan. Rejection reasons from earlier attempts are
 * repeated in the prompt so the model can correct itself.
 */
@Service
public class PlanGenerator {
    private static final Logger log = LoggerFactory.getLogger(PlanGenerator.class);

    static final String SYSTEM_PROMPT = """
            You plan the analysis of Italian legal questions. Choose which retrieval agents and which
            reasoning experts to activate.

            Retrieval agents:
            - kg_agent: knowledge graph of norms, concepts and their relations
            - api_agent: official norm texts and their versions
            - vectordb_agent: semantic search over doctrine and case law chunks

            Experts:
            - literal: textual meaning of the norm (art. 12 preleggi, first clause)
            - systemic: purpose and position of the norm in the legal system
            - principles: constitutional and general principles, balancing of rights
            - precedent: how courts have interpreted and applied the norm

            Answer with one JSON object and nothing else:
            {"retrieval_agents": {"kg_agent": true, "api_agent": false, "vectordb_agent": true},
             "experts": ["literal", "systemic"],
             "max_iterations": 1,
             "min_confidence": 0.6,
             "rationale": "short justification"}
            Enable at least one retrieval agent and at least one expert.""";

    private final LanguageModelClient languageModel;

    public PlanGenerator(LanguageModelClient languageModel) {
        this.languageModel = languageModel;
    }

    public ExecutionPlan generate(QueryContext query, EnrichedContext enriched, int retryCount,
                                  List<String> rejectionReasons, String refinementNote, String traceId) {
        String userPrompt = buildPrompt(query, enriched, rejectionReasons, refinementNote);
        PlanDraft draft;
        try {
            draft = this.languageModel.generateStructured(SYSTEM_PROMPT, userPrompt, PlanDraft.class);
        }
        catch (LanguageModelUnavailableException e) {
            log.error("Plan generation failed for trace {} at retry {}: {}", traceId, retryCount, e.getMessage());
            throw new PlanGenerationFailedException("Plan generation failed: " + e.getMessage(), retryCount, traceId, e);
        }
        ExecutionPlan plan = toPlan(draft, retryCount + 1);
        log.debug("Trace {} attempt {}: agents={}, experts={}, unknown={}", traceId, plan.attempt(),
                plan.retrievalAgents(), plan.experts(), plan.unknownExperts());
        return plan;
    }

    String buildPrompt(QueryContext query, EnrichedContext enriched, List<String> rejectionReasons, String refinementNote) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Question: ").append(query.queryText()).append('\n');
        if (!query.intents().isEmpty()) {
            prompt.append("Detected intents:");
            for (DetectedIntent intent : query.intents()) {
                prompt.append(String.format(Locale.ROOT, " %s (%.2f)", intent.name(), intent.confidence()));
            }
            prompt.append('\n');
        }
        prompt.append(String.format(Locale.ROOT, "Complexity: %.2f%n", query.complexity()));
        if (!query.entities().isEmpty()) {
            prompt.append("Entities: ").append(String.join(", ", query.entities())).append('\n');
        }
        if (query.temporalScope() != null && !query.temporalScope().isBlank()) {
            prompt.append("Temporal scope: ").append(query.temporalScope()).append('\n');
        }
        appendCandidates(prompt, "Concept candidates", enriched.conceptCandidates());
        appendCandidates(prompt, "Norm candidates", enriched.normCandidates());
        if (rejectionReasons != null && !rejectionReasons.isEmpty()) {
            prompt.append("\nPrevious plans were rejected. Fix these problems:\n");
            for (String reason : rejectionReasons) {
                prompt.append("- ").append(reason).append('\n');
            }
        }
        if (refinementNote != null && !refinementNote.isBlank()) {
            prompt.append("\nRefinement: ").append(refinementNote).append('\n');
        }
        return prompt.toString();
    }

    private static void appendCandidates(StringBuilder prompt, String title, List<KnowledgeCandidate> candidates) {
        if (candidates.isEmpty()) {
            return;
        }
        prompt.append(title).append(':');
        candidates.stream().limit(10).forEach(c ->
                prompt.append(String.format(Locale.ROOT, " %s [%s] (%.2f);", c.label(), c.id(), c.score())));
        prompt.append('\n');
    }

    static ExecutionPlan toPlan(PlanDraft draft, int attempt) {
        if (draft == null) {
            return new ExecutionPlan(Set.of(), List.of(), List.of(), StopCriteria.defaults(), "", attempt);
        }
        Set<RetrievalAgent> agents = EnumSet.noneOf(RetrievalAgent.class);
        if (draft.retrievalAgents() != null) {
            for (Map.Entry<String, Boolean> entry : draft.retrievalAgents().entrySet()) {
                if (Boolean.TRUE.equals(entry.getValue())) {
                    RetrievalAgent.fromId(entry.getKey()).ifPresent(agents::add);
                }
            }
        }
        List<ExpertType> experts = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        if (draft.experts() != null) {
            for (String id : draft.experts()) {
                ExpertType.fromId(id).ifPresentOrElse(
                        type -> {
                            if (!experts.contains(type)) {
                                experts.add(type);
                            }
                        },
                        () -> unknown.add(String.valueOf(id)));
            }
        }
        StopCriteria stop = new StopCriteria(
                draft.maxIterations() == null ? 1 : draft.maxIterations(),
                draft.minConfidence() == null ? 0.0 : draft.minConfidence());
        return new ExecutionPlan(agents, experts, unknown, stop, draft.rationale(), attempt);
    }
}
