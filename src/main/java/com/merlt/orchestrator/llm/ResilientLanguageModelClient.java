package com.merlt.orchestrator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries providers in order. Each provider sits behind its own circuit breaker and call timeout;
 * a provider whose output cannot be parsed into the requested type counts as failed for that
 * call and the next one is tried.
 */
public class ResilientLanguageModelClient implements LanguageModelClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientLanguageModelClient.class);

    private final List<LanguageModelProvider> providers;
    private final List<ProviderCircuitBreaker> breakers;
    private final ObjectMapper objectMapper;
    private final long timeoutMs;

    public ResilientLanguageModelClient(List<LanguageModelProvider> providers, ObjectMapper objectMapper,
                                        long timeoutMs, int failureThreshold, Duration openDuration, int halfOpenMaxCalls) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one language model provider is required");
        }
        this.providers = List.copyOf(providers);
        this.objectMapper = objectMapper;
        this.timeoutMs = Math.max(1L, timeoutMs);
        List<ProviderCircuitBreaker> created = new ArrayList<>();
        for (LanguageModelProvider provider : this.providers) {
            created.add(new ProviderCircuitBreaker(provider.name(), failureThreshold, openDuration, halfOpenMaxCalls));
        }
        this.breakers = List.copyOf(created);
    }

    @Override
    public <T> T generateStructured(String systemPrompt, String userPrompt, Class<T> responseType) {
        List<String> failures = new ArrayList<>();
        Exception lastError = null;
        for (int i = 0; i < this.providers.size(); i++) {
            LanguageModelProvider provider = this.providers.get(i);
            ProviderCircuitBreaker breaker = this.breakers.get(i);
            if (!breaker.tryAcquire()) {
                log.warn("LLM provider '{}' circuit open for another {}ms; skipping", provider.name(), breaker.retryAfterMs());
                failures.add(provider.name() + ": circuit open");
                continue;
            }
            String raw;
            CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> provider.complete(systemPrompt, userPrompt));
            try {
                raw = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
            }
            catch (TimeoutException e) {
                future.cancel(true);
                breaker.onFailure(e);
                log.warn("LLM provider '{}' timed out after {}ms", provider.name(), this.timeoutMs);
                failures.add(provider.name() + ": timeout");
                lastError = e;
                continue;
            }
            catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new LanguageModelUnavailableException("Interrupted while waiting for " + provider.name(), failures, e);
            }
            catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                breaker.onFailure(cause);
                log.warn("LLM provider '{}' failed: {}", provider.name(), cause.getMessage());
                failures.add(provider.name() + ": " + cause.getClass().getSimpleName());
                lastError = e;
                continue;
            }
            try {
                T parsed = parse(raw, responseType);
                breaker.onSuccess();
                return parsed;
            }
            catch (JsonProcessingException | IllegalArgumentException e) {
                breaker.onFailure(e);
                log.warn("LLM provider '{}' returned unparseable {}: {}", provider.name(), responseType.getSimpleName(), e.getMessage());
                failures.add(provider.name() + ": malformed output");
                lastError = e;
            }
        }
        throw new LanguageModelUnavailableException("All language model providers failed: " + failures, failures, lastError);
    }

    <T> T parse(String raw, Class<T> responseType) throws JsonProcessingException {
        String json = extractJson(raw);
        if (json == null) {
            throw new IllegalArgumentException("No JSON object in model output");
        }
        return this.objectMapper.readValue(json, responseType);
    }

    static String extractJson(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int closingFence = text.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                text = text.substring(firstNewline + 1, closingFence).trim();
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    List<ProviderCircuitBreaker> breakers() {
        return this.breakers;
    }
}
