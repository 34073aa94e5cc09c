package com.merlt.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.merlt.orchestrator.llm.ChatClientProvider;
import com.merlt.orchestrator.llm.LanguageModelClient;
import com.merlt.orchestrator.llm.LanguageModelProvider;
import com.merlt.orchestrator.llm.ResilientLanguageModelClient;
import java.time.Duration;
import java.util.List;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LanguageModelConfig {

    @Bean
    public LanguageModelClient languageModelClient(
            ChatClient.Builder chatClientBuilder,
            ObjectMapper objectMapper,
            @Value("${spring.ai.ollama.chat.options.model:llama3.1:8b}") String modelName,
            @Value("${merlt.llm.timeout-ms:20000}") long timeoutMs,
            @Value("${merlt.llm.circuit-breaker.failure-threshold:3}") int failureThreshold,
            @Value("${merlt.llm.circuit-breaker.open-seconds:30}") long openSeconds,
            @Value("${merlt.llm.circuit-breaker.half-open-max-calls:1}") int halfOpenMaxCalls) {
        List<LanguageModelProvider> providers = List.of(new ChatClientProvider("ollama:" + modelName, chatClientBuilder.build()));
        return new ResilientLanguageModelClient(providers, objectMapper, timeoutMs,
                failureThreshold, Duration.ofSeconds(openSeconds), halfOpenMaxCalls);
    }
}
