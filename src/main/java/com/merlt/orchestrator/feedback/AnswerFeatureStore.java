package com.merlt.orchestrator.feedback;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class AnswerFeatureStore {
    private final Cache<String, AnswerFeatures> cache;

    public AnswerFeatureStore(@Value("${merlt.orchestrator.answer-cache-ttl-minutes:60}") long ttlMinutes,
                              @Value("${merlt.orchestrator.answer-cache-max-size:10000}") long maxSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, maxSize))
                .expireAfterWrite(Duration.ofMinutes(Math.max(1L, ttlMinutes)))
                .build();
    }

    public void put(AnswerFeatures features) {
        if (features != null && features.traceId() != null) {
            this.cache.put(features.traceId(), features);
        }
    }

    public Optional<AnswerFeatures> find(String traceId) {
        return traceId == null ? Optional.empty() : Optional.ofNullable(this.cache.getIfPresent(traceId));
    }
}
