package com.merlt.orchestrator.expert;

import com.merlt.orchestrator.exception.PipelineStage;
import com.merlt.orchestrator.exception.RequestCancelledException;
import com.merlt.orchestrator.model.EnrichedContext;
import com.merlt.orchestrator.model.ExecutionPlan;
import com.merlt.orchestrator.model.ExpertOpinion;
import com.merlt.orchestrator.model.ExpertType;
import com.merlt.orchestrator.model.OpinionFlag;
import com.merlt.orchestrator.model.QueryContext;
import com.merlt.orchestrator.reasoning.ReasoningStep;
import com.merlt.orchestrator.reasoning.ReasoningTrace;
import com.merlt.orchestrator.reasoning.ReasoningTracer;
import com.merlt.orchestrator.util.CancellationToken;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs the experts selected by a plan concurrently and waits for each one up to its own budget.
 * An expert that times out, fails or is cancelled yields a degraded opinion instead of an error;
 * only cancellation of the whole request aborts the join.
 */
@Service
public class ExpertDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ExpertDispatcher.class);
    private static final long POLL_SLICE_MS = 50L;

    private final Map<ExpertType, ReasoningExpert> experts = new EnumMap<>(ExpertType.class);
    private final ExecutorService executor;
    private final ReasoningTracer tracer;
    @Value("${merlt.experts.timeout-ms:5000}")
    private long timeoutMs = 5000L;

    public ExpertDispatcher(List<ReasoningExpert> experts,
                            @Qualifier("expertExecutor") ExecutorService executor,
                            ReasoningTracer tracer) {
        for (ReasoningExpert expert : experts) {
            this.experts.put(expert.type(), expert);
        }
        this.executor = executor;
        this.tracer = tracer;
    }

    public List<ExpertOpinion> dispatch(ExecutionPlan plan, QueryContext query, EnrichedContext enriched,
                                        CancellationToken requestToken, ReasoningTrace trace) {
        CancellationToken request = requestToken == null ? CancellationToken.none() : requestToken;
        String traceId = trace == null ? null : trace.getTraceId();
        List<Task> tasks = new ArrayList<>();
        for (ExpertType type : plan.experts()) {
            tasks.add(submit(type, plan, query, enriched, request));
        }
        this.tracer.addStep(trace, ReasoningStep.StepType.EXPERT_DISPATCH, "Dispatched " + tasks.size() + " experts",
                plan.experts().toString(), 0L, Map.of("timeoutMs", this.timeoutMs));

        List<ExpertOpinion> opinions = new ArrayList<>();
        for (Task task : tasks) {
            ExpertOpinion opinion = join(task, request, tasks, traceId);
            opinions.add(opinion);
            this.tracer.addStep(trace, ReasoningStep.StepType.EXPERT_OPINION, "Expert " + task.type.id(),
                    opinion.flags().isEmpty() ? "ok" : opinion.flags().toString(), opinion.durationMs(),
                    Map.of("confidence", opinion.confidence(), "toolRounds", opinion.toolRounds(),
                            "evidence", opinion.evidence().size()));
        }
        return opinions;
    }

    private Task submit(ExpertType type, ExecutionPlan plan, QueryContext query, EnrichedContext enriched,
                        CancellationToken request) {
        long submittedAt = System.currentTimeMillis();
        CancellationToken token = request.child(this.timeoutMs);
        ReasoningExpert expert = this.experts.get(type);
        if (expert == null) {
            return Task.completed(type, token, submittedAt,
                    ExpertOpinion.degraded(type, OpinionFlag.FAILED, "expert not registered", 0L));
        }
        try {
            CompletableFuture<ExpertOpinion> future = CompletableFuture.supplyAsync(
                    () -> expert.analyze(query, enriched, plan, token), this.executor);
            return new Task(type, token, submittedAt, future);
        }
        catch (RejectedExecutionException e) {
            log.warn("Expert {} rejected by executor: {}", type.id(), e.getMessage());
            return Task.completed(type, token, submittedAt,
                    ExpertOpinion.degraded(type, OpinionFlag.FAILED, "executor overloaded", 0L));
        }
    }

    private ExpertOpinion join(Task task, CancellationToken request, List<Task> all, String traceId) {
        long deadline = task.submittedAt + this.timeoutMs;
        while (true) {
            if (request.shouldStop()) {
                throw abort(task, all, traceId);
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0L) {
                return timedOut(task, traceId);
            }
            try {
                return task.future.get(Math.min(POLL_SLICE_MS, remaining), TimeUnit.MILLISECONDS);
            }
            catch (TimeoutException e) {
                // poll again so request cancellation is noticed within one slice
                continue;
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(all, "interrupted");
                throw new RequestCancelledException("Interrupted while waiting for experts",
                        PipelineStage.EXPERT_EXECUTION, traceId);
            }
            catch (CancellationException e) {
                if (request.shouldStop()) {
                    throw abort(task, all, traceId);
                }
                return ExpertOpinion.degraded(task.type, OpinionFlag.CANCELLED, null, elapsed(task));
            }
            catch (ExecutionException e) {
                // an expert stopped by the request's own cancellation must not pass for a result
                if (request.shouldStop()) {
                    throw abort(task, all, traceId);
                }
                return fromFailure(task, e.getCause(), traceId);
            }
        }
    }

    private RequestCancelledException abort(Task task, List<Task> all, String traceId) {
        cancelAll(all, "request cancelled");
        log.info("Trace {} cancelled while waiting for expert {}", traceId, task.type.id());
        return new RequestCancelledException("Request cancelled while experts were running",
                PipelineStage.EXPERT_EXECUTION, traceId);
    }

    private ExpertOpinion timedOut(Task task, String traceId) {
        task.token.cancel(OpinionFlag.TIMED_OUT.label());
        task.future.cancel(true);
        log.warn("Trace {} expert {} timed out after {}ms", traceId, task.type.id(), this.timeoutMs);
        return ExpertOpinion.degraded(task.type, OpinionFlag.TIMED_OUT, null, elapsed(task));
    }

    private ExpertOpinion fromFailure(Task task, Throwable cause, String traceId) {
        if (cause instanceof CancellationException) {
            OpinionFlag flag = task.token.isCancelled() && !task.token.isExpired()
                    ? OpinionFlag.CANCELLED : OpinionFlag.TIMED_OUT;
            return ExpertOpinion.degraded(task.type, flag, null, elapsed(task));
        }
        String detail = cause == null ? "unknown" : cause.getClass().getSimpleName();
        log.warn("Trace {} expert {} failed: {}", traceId, task.type.id(), cause == null ? "unknown" : cause.getMessage());
        return ExpertOpinion.degraded(task.type, OpinionFlag.FAILED, detail, elapsed(task));
    }

    private static void cancelAll(List<Task> tasks, String reason) {
        for (Task task : tasks) {
            task.token.cancel(reason);
            task.future.cancel(true);
        }
    }

    private static long elapsed(Task task) {
        return System.currentTimeMillis() - task.submittedAt;
    }

    public long getTimeoutMs() {
        return this.timeoutMs;
    }

    private static final class Task {
        private final ExpertType type;
        private final CancellationToken token;
        private final long submittedAt;
        private final CompletableFuture<ExpertOpinion> future;

        private Task(ExpertType type, CancellationToken token, long submittedAt, CompletableFuture<ExpertOpinion> future) {
            this.type = type;
            this.token = token;
            this.submittedAt = submittedAt;
            this.future = future;
        }

        private static Task completed(ExpertType type, CancellationToken token, long submittedAt, ExpertOpinion opinion) {
            return new Task(type, token, submittedAt, CompletableFuture.completedFuture(opinion));
        }
    }
}
