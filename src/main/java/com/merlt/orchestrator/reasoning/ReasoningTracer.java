package com.merlt.orchestrator.reasoning;

import com.merlt.orchestrator.util.LogSanitizer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates and caches per-request traces. Traces are passed explicitly rather than kept in a
 * thread local because experts record steps from pool threads.
 */
@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);
    private static final int MAX_CACHED_TRACES = 1000;
    @Value(value = "${merlt.reasoning.enabled:true}")
    private boolean enabled = true;
    @Value(value = "${merlt.reasoning.detailed-traces:false}")
    private boolean detailedTraces;
    private final Map<String, ReasoningTrace> traceCache = new ConcurrentHashMap<>();

    public ReasoningTrace startTrace(String query) {
        ReasoningTrace trace = new ReasoningTrace(LogSanitizer.querySummary(query));
        log.debug("Started reasoning trace {} for query {}", trace.getTraceId(), trace.getQuerySummary());
        return trace;
    }

    public void addStep(ReasoningTrace trace, ReasoningStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(trace, type, label, detail, durationMs, Map.of());
    }

    public void addStep(ReasoningTrace trace, ReasoningStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        if (!this.enabled || trace == null) {
            return;
        }
        trace.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
        if (this.detailedTraces) {
            log.debug("Trace[{}] Step: {} - {} ({}ms)", trace.getTraceId(), type, label, durationMs);
        }
    }

    public void addMetric(ReasoningTrace trace, String key, Object value) {
        if (this.enabled && trace != null) {
            trace.addMetric(key, value);
        }
    }

    public ReasoningTrace endTrace(ReasoningTrace trace) {
        if (trace == null) {
            return null;
        }
        trace.complete();
        if (this.enabled) {
            this.cacheTrace(trace);
        }
        log.debug("Completed reasoning trace: {}", trace.getSummary());
        return trace;
    }

    public ReasoningTrace getTrace(String traceId) {
        return this.traceCache.get(traceId);
    }

    /**
     * Runs {@code operation} and records it as one step, or as an ERROR step if it throws.
     */
    public <T> T timed(ReasoningTrace trace, ReasoningStep.StepType type, String label, Supplier<T> operation) {
        long start = System.currentTimeMillis();
        T result;
        try {
            result = operation.get();
        }
        catch (RuntimeException e) {
            this.addStep(trace, ReasoningStep.StepType.ERROR, label + " (Failed)",
                    LogSanitizer.sanitize(e.getMessage()), System.currentTimeMillis() - start);
            throw e;
        }
        this.addStep(trace, type, label, "", System.currentTimeMillis() - start);
        return result;
    }

    private void cacheTrace(ReasoningTrace trace) {
        if (this.traceCache.size() >= MAX_CACHED_TRACES) {
            this.traceCache.keySet().stream().limit(100L).toList().forEach(this.traceCache::remove);
        }
        this.traceCache.put(trace.getTraceId(), trace);
    }

    public void clearCache() {
        this.traceCache.clear();
    }

    public boolean isEnabled() {
        return this.enabled;
    }
}
