package com.merlt.orchestrator.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.merlt.orchestrator.exception.InsufficientEvidenceException;
import com.merlt.orchestrator.exception.PipelineStage;
import com.merlt.orchestrator.exception.PlanGenerationFailedException;
import com.merlt.orchestrator.exception.RequestCancelledException;
import com.merlt.orchestrator.expert.ExpertDispatcher;
import com.merlt.orchestrator.feedback.AnswerFeatureStore;
import com.merlt.orchestrator.feedback.FeedbackOutcome;
import com.merlt.orchestrator.feedback.FeedbackProcessor;
import com.merlt.orchestrator.gating.GatingNetwork;
import com.merlt.orchestrator.model.EnrichedContext;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.ExpertOpinion;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.FeedbackRecord;
import com.merlt.orchestrator.model.OpinionFlag;
import com.merlt.orchestrator.model.QueryContext;
import com.merlt.orchestrator.model.RetrievalAgent;
import com.merlt.orchestrator.model.StopCriteria;
import com.merlt.orchestrator.model.SynthesisMode;
import com.merlt.orchestrator.model.SynthesizedAnswer;
import com.merlt.orchestrator.reasoning.ReasoningStep;
import com.merlt.orchestrator.reasoning.ReasoningTrace;
import com.merlt.orchestrator.reasoning.ReasoningTracer;
import com.merlt.orchestrator.retrieval.QueryEncoder;
import com.merlt.orchestrator.router.ExecutionPlanRouter;
import com.merlt.orchestrator.synthesis.Synthesizer;
import com.merlt.orchestrator.util.CancellationToken;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LegalQueryOrchestratorTest {
    private ExecutionPlanRouter router;
    private QueryEncoder encoder;
    private ExpertDispatcher dispatcher;
    private FeedbackProcessor feedbackProcessor;
    private AnswerFeatureStore answerFeatures;
    private ReasoningTracer tracer;
    private LegalQueryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        this.router = mock(ExecutionPlanRouter.class);
        this.encoder = mock(QueryEncoder.class);
        this.dispatcher = mock(ExpertDispatcher.class);
        this.feedbackProcessor = mock(FeedbackProcessor.class);
        this.answerFeatures = new AnswerFeatureStore(60, 100);
        this.tracer = new ReasoningTracer();
        when(this.encoder.encode(anyString())).thenReturn(new float[] {0.1f, 0.2f, 0.3f, 0.4f});
        this.orchestrator = orchestrator(0.4);
    }

    private LegalQueryOrchestrator orchestrator(double agreement) {
        return new LegalQueryOrchestrator(this.router, this.encoder,
                new GatingNetwork(4, 0.01, 0.1, 0.30, 0.25, 0.20, 0.25), this.dispatcher,
                new Synthesizer((a, b) -> agreement), this.feedbackProcessor, this.answerFeatures, this.tracer);
    }

    private static ExecutionPlan plan(StopCriteria stop, ExpertType... experts) {
        return new ExecutionPlan(Set.of(RetrievalAgent.VECTOR_DB), List.of(experts), List.of(), stop, "test plan", 1);
    }

    private static ExpertOpinion opinion(ExpertType type, String text, double confidence) {
        return new ExpertOpinion(type, text, Map.of(), confidence, List.of("src:" + type.id()), List.of(), Set.of(), List.of(), 1, 10L);
    }

    private void routeTo(ExecutionPlan plan) {
        when(this.router.route(any(), any(), any(), any())).thenReturn(plan);
    }

    private void expertsAnswer(List<ExpertOpinion> opinions) {
        when(this.dispatcher.dispatch(any(), any(), any(), any(), any())).thenReturn(opinions);
    }

    @Nested
    @DisplayName("Answering queries")
    class QueryTest {
        @Test
        @DisplayName("A simple definitional query is answered by the literal expert alone")
        void singleExpert() {
            routeTo(plan(StopCriteria.defaults(), ExpertType.LITERAL));
            expertsAnswer(List.of(opinion(ExpertType.LITERAL, "A contract needs agreement, cause, object and form.", 0.82)));

            SynthesizedAnswer answer = orchestrator.handleQuery(QueryContext.of("What is a contract?"), EnrichedContext.empty());

            assertThat(answer.mode()).isEqualTo(SynthesisMode.CONVERGENT);
            assertThat(answer.confidence()).isCloseTo(0.82, within(1e-9));
            assertThat(answer.iterations()).isEqualTo(1);
            assertThat(answer.traceId()).isNotBlank();
            assertThat(answerFeatures.find(answer.traceId())).get()
                    .satisfies(f -> assertThat(f.experts()).containsExactly(ExpertType.LITERAL));
        }

        @Test
        @DisplayName("Four disagreeing experts give a divergent answer")
        void fourExperts() {
            routeTo(plan(StopCriteria.defaults(), ExpertType.LITERAL, ExpertType.SYSTEMIC, ExpertType.PRINCIPLES, ExpertType.PRECEDENT));
            expertsAnswer(List.of(
                    opinion(ExpertType.LITERAL, "Void under the wording", 0.9),
                    opinion(ExpertType.SYSTEMIC, "Valid within the system", 0.8),
                    opinion(ExpertType.PRINCIPLES, "Balanced by good faith", 0.7),
                    opinion(ExpertType.PRECEDENT, "Courts are split", 0.6)));

            SynthesizedAnswer answer = orchestrator.handleQuery(QueryContext.of("Is the clause abusive?"), null);

            assertThat(answer.mode()).isEqualTo(SynthesisMode.DIVERGENT);
            assertThat(answer.confidence()).isLessThan(0.9);
            assertThat(answer.contributions()).hasSize(4);
        }

        @Test
        @DisplayName("When every expert times out the caller gets InsufficientEvidence")
        void allTimedOut() {
            routeTo(plan(StopCriteria.defaults(), ExpertType.LITERAL, ExpertType.SYSTEMIC, ExpertType.PRINCIPLES, ExpertType.PRECEDENT));
            expertsAnswer(List.of(
                    ExpertOpinion.degraded(ExpertType.LITERAL, OpinionFlag.TIMED_OUT, null, 5000L),
                    ExpertOpinion.degraded(ExpertType.SYSTEMIC, OpinionFlag.TIMED_OUT, null, 5000L),
                    ExpertOpinion.degraded(ExpertType.PRINCIPLES, OpinionFlag.TIMED_OUT, null, 5000L),
                    ExpertOpinion.degraded(ExpertType.PRECEDENT, OpinionFlag.TIMED_OUT, null, 5000L)));

            assertThatThrownBy(() -> orchestrator.handleQuery(QueryContext.of("Hard question"), EnrichedContext.empty()))
                    .isInstanceOf(InsufficientEvidenceException.class)
                    .satisfies(e -> assertThat(((InsufficientEvidenceException) e).getStage()).isEqualTo(PipelineStage.SYNTHESIS));
        }

        @Test
        @DisplayName("A planning failure propagates and no expert runs")
        void failureIsTraced() {
            when(router.route(any(), any(), any(), any()))
                    .thenThrow(new PlanGenerationFailedException("model down", 2, "t", null));

            assertThatThrownBy(() -> orchestrator.handleQuery(QueryContext.of("Anything"), EnrichedContext.empty()))
                    .isInstanceOf(PlanGenerationFailedException.class);

            verify(dispatcher, never()).dispatch(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Encoder failure falls back to routing on the priors")
        void encoderFailure() {
            when(encoder.encode(anyString())).thenThrow(new IllegalStateException("embedding service down"));
            routeTo(plan(StopCriteria.defaults(), ExpertType.LITERAL));
            expertsAnswer(List.of(opinion(ExpertType.LITERAL, "Answer", 0.7)));

            SynthesizedAnswer answer = orchestrator.handleQuery(QueryContext.of("Query"), EnrichedContext.empty());

            ReasoningTrace trace = orchestrator.getTrace(answer.traceId());
            assertThat(trace).isNotNull();
            assertThat(trace.getSteps(ReasoningStep.StepType.ERROR)).hasSize(1);
            assertThat(trace.getSteps(ReasoningStep.StepType.GATING)).hasSize(1);
        }

        @Test
        @DisplayName("A cancelled request stops before planning")
        void cancelled() {
            CancellationToken token = CancellationToken.withTimeout(60_000);
            token.cancel("client gone");

            assertThatThrownBy(() -> orchestrator.handleQuery(QueryContext.of("Query"), EnrichedContext.empty(), token))
                    .isInstanceOf(RequestCancelledException.class)
                    .satisfies(e -> assertThat(((RequestCancelledException) e).getStage()).isEqualTo(PipelineStage.PLAN_GENERATION));
            verify(router, never()).route(any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Refinement")
    class RefinementTest {
        @Test
        @DisplayName("Low confidence asks for a refined plan and the confident answer ends the loop")
        void refinesUntilConfident() {
            routeTo(plan(new StopCriteria(3, 0.8), ExpertType.LITERAL));
            when(dispatcher.dispatch(any(), any(), any(), any(), any()))
                    .thenReturn(List.of(opinion(ExpertType.LITERAL, "Tentative", 0.5)))
                    .thenReturn(List.of(opinion(ExpertType.LITERAL, "Confident", 0.85)));

            SynthesizedAnswer answer = orchestrator.handleQuery(QueryContext.of("Query"), EnrichedContext.empty());

            assertThat(answer.confidence()).isCloseTo(0.85, within(1e-9));
            assertThat(answer.iterations()).isEqualTo(2);
            ArgumentCaptor<String> note = ArgumentCaptor.forClass(String.class);
            verify(router, times(2)).route(any(), any(), note.capture(), any());
            assertThat(note.getAllValues().get(0)).isNull();
            assertThat(note.getAllValues().get(1)).contains("0.50").contains("0.80");
        }

        @Test
        @DisplayName("A failing refinement keeps the best earlier answer")
        void keepsBestOnFailure() {
            ExecutionPlan refinable = plan(new StopCriteria(3, 0.9), ExpertType.LITERAL);
            when(router.route(any(), any(), any(), any()))
                    .thenReturn(refinable)
                    .thenThrow(new PlanGenerationFailedException("model down", 2, "t", null));
            expertsAnswer(List.of(opinion(ExpertType.LITERAL, "Tentative", 0.6)));

            SynthesizedAnswer answer = orchestrator.handleQuery(QueryContext.of("Query"), EnrichedContext.empty());

            assertThat(answer.confidence()).isCloseTo(0.6, within(1e-9));
            assertThat(answer.iterations()).isEqualTo(1);
        }

        @Test
        @DisplayName("The plan's iteration budget bounds the loop")
        void boundedIterations() {
            routeTo(plan(new StopCriteria(2, 0.99), ExpertType.LITERAL));
            expertsAnswer(List.of(opinion(ExpertType.LITERAL, "Never good enough", 0.5)));

            SynthesizedAnswer answer = orchestrator.handleQuery(QueryContext.of("Query"), EnrichedContext.empty());

            assertThat(answer.confidence()).isCloseTo(0.5, within(1e-9));
            verify(router, times(2)).route(any(), any(), any(), any());
        }
    }

    @Test
    @DisplayName("Feedback is handed to the processor")
    void feedbackDelegates() {
        FeedbackRecord record = new FeedbackRecord("fb-1", "trace-1", "u1", 4, Map.of(), Map.of(), null, null);
        FeedbackOutcome outcome = FeedbackOutcome.accepted(0.6, false, 0);
        when(feedbackProcessor.ingest(eq(record))).thenReturn(outcome);

        assertThat(orchestrator.handleFeedback(record)).isSameAs(outcome);
    }
}
