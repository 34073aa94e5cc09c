package com.merlt.orchestrator.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.merlt.orchestrator.exception.PipelineStage;
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
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlanGeneratorTest {

    @Test
    @DisplayName("toPlan() resolves known ids and keeps unknown ones for validation")
    void toPlanResolvesIds() {
        PlanDraft draft = new PlanDraft(Map.of("kg_agent", true, "api_agent", false, "mystery_agent", true),
                List.of("literal", "precedent_expert", "LITERAL", "historical"), 2, 0.7, "because");

        ExecutionPlan plan = PlanGenerator.toPlan(draft, 3);

        assertThat(plan.retrievalAgents()).containsExactly(RetrievalAgent.KNOWLEDGE_GRAPH);
        assertThat(plan.experts()).containsExactly(ExpertType.LITERAL, ExpertType.PRECEDENT);
        assertThat(plan.unknownExperts()).containsExactly("historical");
        assertThat(plan.stopCriteria().maxIterations()).isEqualTo(2);
        assertThat(plan.attempt()).isEqualTo(3);
    }

    @Test
    @DisplayName("toPlan() defaults missing stop criteria to a single pass")
    void toPlanDefaults() {
        ExecutionPlan plan = PlanGenerator.toPlan(new PlanDraft(null, null, null, null, null), 1);
        assertThat(plan.retrievalAgents()).isEmpty();
        assertThat(plan.experts()).isEmpty();
        assertThat(plan.stopCriteria().maxIterations()).isEqualTo(1);
        assertThat(plan.stopCriteria().minConfidence()).isZero();
    }

    @Test
    @DisplayName("Prompt carries intents, candidates, rejection reasons and the refinement note")
    void promptContents() {
        PlanGenerator generator = new PlanGenerator(mock(LanguageModelClient.class));
        QueryContext query = new QueryContext("Cos'è la legittima difesa?", List.of("art. 52 c.p."),
                List.of(new DetectedIntent("norm_explanation", 0.9)), 0.4, "vigente");
        EnrichedContext enriched = new EnrichedContext(
                List.of(new KnowledgeCandidate("concept:difesa", "legittima difesa", 0.92)),
                List.of(new KnowledgeCandidate("cp:art52", "Art. 52 c.p.", 0.88)));

        String prompt = generator.buildPrompt(query, enriched,
                List.of("intent 'norm_explanation' requires the literal expert"), "add case law");

        assertThat(prompt)
                .contains("norm_explanation (0.90)")
                .contains("Entities: art. 52 c.p.")
                .contains("Art. 52 c.p. [cp:art52]")
                .contains("- intent 'norm_explanation' requires the literal expert")
                .contains("Refinement: add case law");
    }

    @Test
    @DisplayName("A long question reaches the prompt in full")
    void longQuestionIsNotTruncated() {
        PlanGenerator generator = new PlanGenerator(mock(LanguageModelClient.class));
        String question = "Un lavoratore assunto con contratto a tempo determinato, prorogato più volte oltre il limite "
                + "massimo di durata previsto dalla legge, viene licenziato alla scadenza dell'ultima proroga senza "
                + "che il datore abbia indicato alcuna causale; alla luce dell'art. 19 e dell'art. 21 del d.lgs. "
                + "81/2015, il lavoratore può ottenere la conversione del rapporto e la reintegrazione?";

        String prompt = generator.buildPrompt(QueryContext.of(question), EnrichedContext.empty(), List.of(), null);

        assertThat(question.length()).isGreaterThan(300);
        assertThat(prompt).contains("Question: " + question + "\n");
    }

    @Test
    @DisplayName("Unreachable model becomes PlanGenerationFailedException with the retry count")
    void modelUnavailable() {
        LanguageModelClient llm = mock(LanguageModelClient.class);
        when(llm.generateStructured(anyString(), anyString(), eq(PlanDraft.class)))
                .thenThrow(new LanguageModelUnavailableException("all providers failed", List.of("ollama: timeout"), null));
        PlanGenerator generator = new PlanGenerator(llm);

        assertThatThrownBy(() -> generator.generate(QueryContext.of("q"), EnrichedContext.empty(), 2, List.of(), null, "t-1"))
                .isInstanceOf(PlanGenerationFailedException.class)
                .satisfies(e -> {
                    PlanGenerationFailedException failure = (PlanGenerationFailedException) e;
                    assertThat(failure.getStage()).isEqualTo(PipelineStage.PLAN_GENERATION);
                    assertThat(failure.getRetryCount()).isEqualTo(2);
                    assertThat(failure.getTraceId()).isEqualTo("t-1");
                });
    }
}
