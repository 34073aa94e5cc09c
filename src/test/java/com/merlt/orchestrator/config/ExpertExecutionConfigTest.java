package com.merlt.orchestrator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.merlt.orchestrator.expert.ExpertDispatcher;
import com.merlt.orchestrator.expert.ReasoningExpert;
import com.merlt.orchestrator.model.EnrichedContext;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.ExpertOpinion;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.OpinionFlag;
import com.merlt.orchestrator.model.QueryContext;
import com.merlt.orchestrator.model.RetrievalAgent;
import com.merlt.orchestrator.model.StopCriteria;
import com.merlt.orchestrator.reasoning.ReasoningTracer;
import com.merlt.orchestrator.util.CancellationToken;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExpertExecutionConfigTest {
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicReference<String> workerName = new AtomicReference<>();
    private ThreadPoolExecutor pool;

    @BeforeEach
    void setUp() throws InterruptedException {
        pool = new ExpertExecutionConfig().expertExecutor(1, 1, 1);
        CountDownLatch started = new CountDownLatch(1);
        pool.execute(() -> {
            workerName.set(Thread.currentThread().getName());
            started.countDown();
            awaitRelease();
        });
        pool.execute(this::awaitRelease);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        pool.shutdownNow();
    }

    private void awaitRelease() {
        try {
            release.await(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("Workers are named daemon threads and a full queue rejects instead of running on the caller")
    void saturatedPoolRejects() {
        assertThat(workerName.get()).startsWith(ExpertExecutionConfig.THREAD_PREFIX);
        assertThatThrownBy(() -> pool.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class)
                .hasMessageStartingWith("expert pool saturated");
    }

    @Test
    @DisplayName("The dispatcher turns a rejected expert into a failed opinion")
    void dispatcherDegradesRejectedExpert() {
        ReasoningExpert literal = mock(ReasoningExpert.class);
        when(literal.type()).thenReturn(ExpertType.LITERAL);
        ReasoningTracer tracer = new ReasoningTracer();
        ExpertDispatcher dispatcher = new ExpertDispatcher(List.of(literal), pool, tracer);
        ExecutionPlan plan = new ExecutionPlan(Set.of(RetrievalAgent.VECTOR_DB), List.of(ExpertType.LITERAL),
                List.of(), StopCriteria.defaults(), "", 1);

        List<ExpertOpinion> opinions = dispatcher.dispatch(plan, QueryContext.of("q"), EnrichedContext.empty(),
                CancellationToken.none(), tracer.startTrace("q"));

        assertThat(opinions).singleElement().satisfies(opinion -> {
            assertThat(opinion.hasFlag(OpinionFlag.FAILED)).isTrue();
            assertThat(opinion.confidence()).isZero();
            assertThat(opinion.limitations()).anySatisfy(l -> assertThat(l).endsWith("executor overloaded"));
        });
        verify(literal, never()).analyze(any(), any(), any(), any());
    }
}
