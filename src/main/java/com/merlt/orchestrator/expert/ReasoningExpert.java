package com.merlt.orchestrator.expert;

import com.merlt.orchestrator.exception.ExpertExecutionException;
import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.llm.LanguageModelUnavailableException;
import com.merlt.orchestrator.model.EnrichedContext;
import com.merlt.orchestrator.model.Evidence;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.ExpertOpinion;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.KnowledgeCandidate;
import com.merlt.orchestrator.model.OpinionFlag;
import com.merlt.orchestrator.model.QueryContext;
import com.merlt.orchestrator.model.RetrievalAgent;
import com.merlt.orchestrator.retrieval.KnowledgeRetrievalClient;
import com.merlt.orchestrator.retrieval.RelatedNode;
import com.merlt.orchestrator.retrieval.RetrievedChunk;
import com.merlt.orchestrator.util.CancellationToken;
import com.merlt.orchestrator.util.LogSanitizer;
import com.merlt.orchestrator.weights.TraversalWeightStore;
import com.merlt.orchestrator.weights.TraversalWeights;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared harness of the four reasoning experts. A run goes DISPATCH, then any number of
 * TOOL_CALL/TOOL_RESULT rounds chosen by the model, then FINALIZE.
 *
 * <p>Every traversal hit is ranked by its raw score times this expert's weight for the relation
 * that produced it, which is what makes the experts look at different parts of the graph. The
 * weights are read once per run from a snapshot.</p>
 *
 * <p>The run checks its {@link CancellationToken} between rounds and stops with a
 * {@link CancellationException} once it is cancelled or past its deadline.</p>
 */
public abstract class ReasoningExpert {
    private static final Logger log = LoggerFactory.getLogger(ReasoningExpert.class);
    private static final int MAX_EVIDENCE_CHARS = 400;
    private static final int SEED_TRAVERSAL_NODES = 2;

    private final ExpertProfile profile;
    private final LanguageModelClient languageModel;
    private final KnowledgeRetrievalClient retrieval;
    private final TraversalWeightStore weightStore;
    private final ExpertSettings settings;

    protected ReasoningExpert(ExpertProfile profile, LanguageModelClient languageModel,
                              KnowledgeRetrievalClient retrieval, TraversalWeightStore weightStore,
                              ExpertSettings settings) {
        this.profile = profile;
        this.languageModel = languageModel;
        this.retrieval = retrieval;
        this.weightStore = weightStore;
        this.settings = settings;
    }

    public ExpertType type() {
        return this.profile.type();
    }

    public ExpertProfile profile() {
        return this.profile;
    }

    public ExpertOpinion analyze(QueryContext query, EnrichedContext enriched, ExecutionPlan plan, CancellationToken token) {
        long start = System.currentTimeMillis();
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;
        TraversalWeights weights = this.weightStore.snapshot(type());
        List<ToolSpec> tools = availableTools(plan);
        Map<String, Evidence> evidence = new LinkedHashMap<>();
        List<String> observations = new ArrayList<>();

        checkCancelled(cancellation);
        dispatch(query, enriched, plan, weights, evidence, observations);

        int rounds = 0;
        boolean incomplete = false;
        int maxRounds = this.settings.getMaxToolRounds();
        while (true) {
            checkCancelled(cancellation);
            ToolDecision decision = decide(query, tools, evidence, observations, rounds, maxRounds);
            if (!decision.callsTool()) {
                break;
            }
            if (rounds >= maxRounds) {
                incomplete = true;
                log.info("Expert {} reached the {} round limit; finalizing with {} evidence items",
                        type().id(), maxRounds, evidence.size());
                break;
            }
            rounds++;
            executeTool(decision, query, enriched, plan, tools, weights, evidence, observations);
        }

        checkCancelled(cancellation);
        ExpertAnalysis analysis = finalizeAnalysis(query, evidence, observations, incomplete);
        long duration = System.currentTimeMillis() - start;
        return toOpinion(analysis, evidence, rounds, incomplete, duration);
    }

    /**
     * Seed retrieval: one semantic search on the question plus a traversal from the best norm
     * candidates along this expert's primary relations.
     */
    private void dispatch(QueryContext query, EnrichedContext enriched, ExecutionPlan plan,
                          TraversalWeights weights, Map<String, Evidence> evidence, List<String> observations) {
        if (searchEnabled(plan)) {
            runSearch(query.queryText(), plan, this.settings.getSeedTopK(), evidence, observations);
        }
        if (plan == null || plan.isAgentEnabled(RetrievalAgent.KNOWLEDGE_GRAPH)) {
            this.profile.primaryTraversal().ifPresent(tool -> enriched.normCandidates().stream()
                    .sorted(Comparator.comparingDouble(KnowledgeCandidate::score).reversed())
                    .limit(SEED_TRAVERSAL_NODES)
                    .forEach(candidate -> runTraversal(tool, candidate.id(), weights, evidence, observations)));
        }
    }

    private ToolDecision decide(QueryContext query, List<ToolSpec> tools, Map<String, Evidence> evidence,
                                List<String> observations, int rounds, int maxRounds) {
        if (tools.isEmpty()) {
            return ToolDecision.finalizeNow("no tools available");
        }
        try {
            ToolDecision decision = this.languageModel.generateStructured(
                    decisionSystemPrompt(tools), decisionUserPrompt(query, evidence, observations, rounds, maxRounds),
                    ToolDecision.class);
            return decision == null ? ToolDecision.finalizeNow("empty decision") : decision;
        }
        catch (LanguageModelUnavailableException e) {
            log.warn("Expert {} could not decide next step, finalizing: {}", type().id(), e.getMessage());
            observations.add("decision step failed; finalizing with gathered evidence");
            return ToolDecision.finalizeNow("decision failure");
        }
    }

    private void executeTool(ToolDecision decision, QueryContext query, EnrichedContext enriched, ExecutionPlan plan,
                             List<ToolSpec> tools, TraversalWeights weights,
                             Map<String, Evidence> evidence, List<String> observations) {
        ToolSpec tool = tools.stream().filter(t -> t.name().equalsIgnoreCase(decision.tool().trim())).findFirst().orElse(null);
        if (tool == null) {
            observations.add("unknown or disabled tool '" + LogSanitizer.sanitize(decision.tool()) + "'");
            return;
        }
        String argument = decision.argument() == null ? "" : decision.argument().trim();
        if (!tool.isTraversal()) {
            runSearch(argument.isEmpty() ? query.queryText() : argument, plan, this.settings.getToolTopK(), evidence, observations);
            return;
        }
        if (argument.isEmpty()) {
            argument = enriched.normCandidates().isEmpty() ? "" : enriched.normCandidates().get(0).id();
        }
        if (argument.isEmpty()) {
            observations.add(tool.name() + ": no start node given");
            return;
        }
        runTraversal(tool, argument, weights, evidence, observations);
    }

    private void runSearch(String text, ExecutionPlan plan, int topK, Map<String, Evidence> evidence, List<String> observations) {
        Map<String, String> filters = plan != null && !plan.isAgentEnabled(RetrievalAgent.VECTOR_DB)
                ? Map.of("source_type", "norm") : Map.of();
        try {
            List<RetrievedChunk> chunks = this.retrieval.search(text, filters, topK);
            for (RetrievedChunk chunk : chunks) {
                merge(evidence, new Evidence(chunk.id(), chunk.text(), null, chunk.score(), chunk.score(), ToolSpec.SEMANTIC_SEARCH));
            }
            observations.add(ToolSpec.SEMANTIC_SEARCH + ": " + chunks.size() + " results");
        }
        catch (RuntimeException e) {
            log.warn("Expert {} semantic search failed: {}", type().id(), e.getMessage());
            observations.add(ToolSpec.SEMANTIC_SEARCH + " failed: " + e.getClass().getSimpleName());
        }
    }

    private void runTraversal(ToolSpec tool, String startNode, TraversalWeights weights,
                              Map<String, Evidence> evidence, List<String> observations) {
        Map<String, Double> relationWeights = new LinkedHashMap<>();
        for (String relation : tool.relationTypes()) {
            relationWeights.put(relation, weights.weight(relation));
        }
        try {
            List<RelatedNode> nodes = this.retrieval.traverse(startNode, tool.relationTypes(), relationWeights);
            for (RelatedNode node : nodes) {
                double weighted = node.rawScore() * weights.weight(node.relationType());
                merge(evidence, new Evidence(node.id(), node.text(), node.relationType(), node.rawScore(), weighted, tool.name()));
            }
            observations.add(tool.name() + "(" + LogSanitizer.sanitize(startNode) + "): " + nodes.size() + " related nodes");
        }
        catch (RuntimeException e) {
            log.warn("Expert {} tool {} failed: {}", type().id(), tool.name(), e.getMessage());
            observations.add(tool.name() + " failed: " + e.getClass().getSimpleName());
        }
    }

    private static void merge(Map<String, Evidence> evidence, Evidence item) {
        if (item.sourceId() == null) {
            return;
        }
        evidence.merge(item.sourceId(), item, (a, b) -> b.weightedScore() > a.weightedScore() ? b : a);
    }

    private ExpertAnalysis finalizeAnalysis(QueryContext query, Map<String, Evidence> evidence,
                                            List<String> observations, boolean incomplete) {
        try {
            ExpertAnalysis analysis = this.languageModel.generateStructured(
                    finalSystemPrompt(), finalUserPrompt(query, evidence, observations, incomplete), ExpertAnalysis.class);
            if (analysis == null || analysis.interpretation() == null || analysis.interpretation().isBlank()) {
                throw new ExpertExecutionException(type(), "Expert " + type().id() + " returned no interpretation", null);
            }
            return analysis;
        }
        catch (LanguageModelUnavailableException e) {
            throw new ExpertExecutionException(type(), "Expert " + type().id() + " could not finalize", e);
        }
    }

    private ExpertOpinion toOpinion(ExpertAnalysis analysis, Map<String, Evidence> evidence, int rounds,
                                    boolean incomplete, long duration) {
        List<Evidence> ranked = evidence.values().stream()
                .sorted(Comparator.comparingDouble(Evidence::weightedScore).reversed())
                .toList();
        List<String> cited = analysis.citedSources() != null && !analysis.citedSources().isEmpty()
                ? analysis.citedSources()
                : ranked.stream().limit(3).map(Evidence::sourceId).toList();
        List<String> limitations = new ArrayList<>();
        if (analysis.limitations() != null) {
            limitations.addAll(analysis.limitations());
        }
        Set<OpinionFlag> flags = EnumSet.noneOf(OpinionFlag.class);
        if (incomplete) {
            flags.add(OpinionFlag.INCOMPLETE_EVIDENCE);
            limitations.add(OpinionFlag.INCOMPLETE_EVIDENCE.label());
        }
        Map<String, String> rationale = new LinkedHashMap<>();
        if (analysis.rationale() != null) {
            analysis.rationale().forEach((k, v) -> {
                if (k != null && v != null) {
                    rationale.put(k, v);
                }
            });
        }
        double confidence = analysis.confidence() == null ? 0.5 : analysis.confidence();
        return new ExpertOpinion(type(), analysis.interpretation().trim(), rationale, confidence, cited,
                limitations, flags, ranked, rounds, duration);
    }

    private List<ToolSpec> availableTools(ExecutionPlan plan) {
        List<ToolSpec> tools = new ArrayList<>();
        for (ToolSpec tool : this.profile.tools()) {
            boolean enabled = tool.isTraversal()
                    ? plan == null || plan.isAgentEnabled(RetrievalAgent.KNOWLEDGE_GRAPH)
                    : searchEnabled(plan);
            if (enabled) {
                tools.add(tool);
            }
        }
        return tools;
    }

    private static boolean searchEnabled(ExecutionPlan plan) {
        return plan == null || plan.isAgentEnabled(RetrievalAgent.VECTOR_DB) || plan.isAgentEnabled(RetrievalAgent.NORM_API);
    }

    private static void checkCancelled(CancellationToken token) {
        if (token.shouldStop()) {
            throw new CancellationException(token.isCancelled() ? token.getReason() : "deadline reached");
        }
    }

    private String decisionSystemPrompt(List<ToolSpec> tools) {
        StringBuilder prompt = new StringBuilder(this.profile.instructions()).append("\n\nTools:\n");
        for (ToolSpec tool : tools) {
            prompt.append("- ").append(tool.name()).append(": ").append(tool.description()).append('\n');
        }
        prompt.append("""

                Decide the next step. Answer with one JSON object and nothing else, either
                {"action": "call_tool", "tool": "<tool name>", "argument": "<text or id>", "reason": "..."}
                or {"action": "finalize", "reason": "..."} when the evidence is sufficient.""");
        return prompt.toString();
    }

    private String decisionUserPrompt(QueryContext query, Map<String, Evidence> evidence,
                                      List<String> observations, int rounds, int maxRounds) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Question: ").append(query.queryText()).append('\n');
        prompt.append("Tool rounds used: ").append(rounds).append(" of ").append(maxRounds).append('\n');
        appendEvidence(prompt, evidence);
        if (!observations.isEmpty()) {
            prompt.append("Observations:\n");
            observations.forEach(o -> prompt.append("- ").append(o).append('\n'));
        }
        return prompt.toString();
    }

    private String finalSystemPrompt() {
        return this.profile.instructions() + """


                Write your opinion as one JSON object and nothing else:
                {"interpretation": "your conclusion", "rationale": {"step": "explanation"},
                 "confidence": 0.0-1.0, "cited_sources": ["source ids"], "limitations": ["..."]}
                Base the conclusion only on the evidence provided and lower the confidence when it is thin.""";
    }

    private String finalUserPrompt(QueryContext query, Map<String, Evidence> evidence,
                                   List<String> observations, boolean incomplete) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Question: ").append(query.queryText()).append('\n');
        appendEvidence(prompt, evidence);
        if (incomplete) {
            prompt.append("Note: the retrieval budget ran out before you were done; say what is missing.\n");
        }
        if (evidence.isEmpty() && !observations.isEmpty()) {
            prompt.append("No evidence was found. Observations: ").append(String.join("; ", observations)).append('\n');
        }
        return prompt.toString();
    }

    private void appendEvidence(StringBuilder prompt, Map<String, Evidence> evidence) {
        if (evidence.isEmpty()) {
            prompt.append("Evidence: none yet\n");
            return;
        }
        prompt.append("Evidence (best first):\n");
        evidence.values().stream()
                .sorted(Comparator.comparingDouble(Evidence::weightedScore).reversed())
                .limit(this.settings.getPromptEvidenceLimit())
                .forEach(e -> prompt.append(String.format(Locale.ROOT, "[%s]%s (%.2f) %s%n",
                        e.sourceId(), e.relationType() == null ? "" : " " + e.relationType(),
                        e.weightedScore(), truncate(e.text()))));
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\n', ' ');
        return flat.length() > MAX_EVIDENCE_CHARS ? flat.substring(0, MAX_EVIDENCE_CHARS) + "..." : flat;
    }
}
